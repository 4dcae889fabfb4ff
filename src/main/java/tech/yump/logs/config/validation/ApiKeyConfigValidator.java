package tech.yump.logs.config.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.util.StringUtils;
import tech.yump.logs.config.LiteLogsProperties;

public class ApiKeyConfigValidator implements ConstraintValidator<ValidApiKeyConfig, LiteLogsProperties.AuthProperties.ApiKeyProperties> {

  @Override
  public boolean isValid(LiteLogsProperties.AuthProperties.ApiKeyProperties value, ConstraintValidatorContext context) {
    if (value == null) {
      return true; // @NotNull on the owning field decides
    }
    // A disabled check needs no key
    return !value.enabled() || StringUtils.hasText(value.key());
  }
}
