package io.stockflow.backend.config;

import io.stockflow.backend.limit.LimitCheckInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  private final LimitCheckInterceptor limitCheckInterceptor;

  public WebConfig(LimitCheckInterceptor limitCheckInterceptor) {
    this.limitCheckInterceptor = limitCheckInterceptor;
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(limitCheckInterceptor).addPathPatterns("/api/**");
  }
}
