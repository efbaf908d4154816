package com.codeheadsystems.tessera.springboot.config;

import com.codeheadsystems.tessera.store.ExpiredSessionPurger;
import com.codeheadsystems.tessera.store.SessionReaper;
import java.time.Duration;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Sweeps expired sessions for stores that keep them until purged, such as the in-memory and JDBC
 * stores. Disabled with {@code tessera.reaper-interval-seconds=0}.
 */
@AutoConfiguration(after = TesseraAutoConfiguration.class)
@ConditionalOnBean(ExpiredSessionPurger.class)
@ConditionalOnExpression("${tessera.reaper-interval-seconds:60} > 0")
public class TesseraReaperAutoConfiguration {

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean
  public SessionReaper sessionReaper(ExpiredSessionPurger purger, TesseraProperties props) {
    SessionReaper reaper = new SessionReaper(purger, Duration.ofSeconds(props.getReaperIntervalSeconds()),
        "tessera-session-reaper");
    reaper.start();
    return reaper;
  }
}
