package io.stockflow.backend.limit;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a handler that creates a quota-bound resource. {@link LimitCheckInterceptor} rejects the
 * request with 403 before the handler runs when the tenant's quota for {@link #value()} is used up.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface CheckLimit {

  LimitType value();
}
