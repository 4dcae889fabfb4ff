package tech.yump.logs.config.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Documented
@Constraint(validatedBy = ApiKeyConfigValidator.class)
@Target({ ElementType.TYPE })
@Retention(RetentionPolicy.RUNTIME)
public @interface ValidApiKeyConfig {
  String message() default "If API key authentication is enabled, a non-blank key (litelogs.auth.api-key.key) must be provided.";
  Class<?>[] groups() default {};
  Class<? extends Payload>[] payload() default {};
}
