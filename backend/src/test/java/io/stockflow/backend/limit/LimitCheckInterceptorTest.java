package io.stockflow.backend.limit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import io.stockflow.backend.exception.MissingTenantContextException;
import io.stockflow.backend.exception.PlanLimitExceededException;
import io.stockflow.backend.multitenancy.RequestScopesTestSupport;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.method.HandlerMethod;

@ExtendWith(MockitoExtension.class)
class LimitCheckInterceptorTest {

  private static final UUID TENANT_ID = UUID.randomUUID();

  @Mock private LimitEnforcementService limitEnforcementService;

  @InjectMocks private LimitCheckInterceptor interceptor;

  private final MockHttpServletRequest request = new MockHttpServletRequest();
  private final MockHttpServletResponse response = new MockHttpServletResponse();

  @AfterEach
  void clearScopes() {
    RequestScopesTestSupport.clear();
  }

  static class WarehouseHandlers {

    @CheckLimit(LimitType.WAREHOUSES)
    public void create() {}

    public void list() {}
  }

  private static HandlerMethod handler(String method) throws NoSuchMethodException {
    return new HandlerMethod(new WarehouseHandlers(), WarehouseHandlers.class.getMethod(method));
  }

  @Test
  void preHandle_annotatedHandler_checksBoundTenant() throws Exception {
    RequestScopesTestSupport.bind(TENANT_ID);

    assertThat(interceptor.preHandle(request, response, handler("create"))).isTrue();

    verify(limitEnforcementService).checkLimit(TENANT_ID, LimitType.WAREHOUSES);
  }

  @Test
  void preHandle_quotaReached_propagatesLimitException() throws Exception {
    RequestScopesTestSupport.bind(TENANT_ID);
    doThrow(new PlanLimitExceededException("warehouses", 1, 1))
        .when(limitEnforcementService)
        .checkLimit(TENANT_ID, LimitType.WAREHOUSES);

    assertThatThrownBy(() -> interceptor.preHandle(request, response, handler("create")))
        .isInstanceOf(PlanLimitExceededException.class);
  }

  @Test
  void preHandle_unannotatedHandler_passesThrough() throws Exception {
    assertThat(interceptor.preHandle(request, response, handler("list"))).isTrue();

    verifyNoInteractions(limitEnforcementService);
  }

  @Test
  void preHandle_nonMethodHandler_passesThrough() {
    assertThat(interceptor.preHandle(request, response, new Object())).isTrue();

    verifyNoInteractions(limitEnforcementService);
  }

  @Test
  void preHandle_annotatedHandlerWithoutTenant_throws() {
    assertThatThrownBy(() -> interceptor.preHandle(request, response, handler("create")))
        .isInstanceOf(MissingTenantContextException.class);
  }
}
