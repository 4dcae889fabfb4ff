package tech.yump.logs;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.logs.config.LiteLogsProperties;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(LiteLogsProperties.class)
public class LiteLogsApplication {

  public static void main(String[] args) {
    SpringApplication.run(LiteLogsApplication.class, args);
    log.info(">>> LiteLogs Application Started <<<");
  }
}
