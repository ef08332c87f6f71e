package tech.grantwell.server.config;

import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.grantwell.engine.store.memory.InMemoryTokenStore;

import java.time.Clock;

/**
 * Drops expired authorization codes and tokens from the in-memory store.
 */
@ApplicationScoped
public class TokenPurgeScheduler {

    private static final Logger LOG = Logger.getLogger(TokenPurgeScheduler.class);

    @Inject
    InMemoryTokenStore tokenStore;

    @Inject
    Clock clock;

    @Inject
    AuthConfig authConfig;

    void onStart(@Observes StartupEvent event) {
        LOG.infof("Purging expired grants and tokens every %s", authConfig.purgeInterval());
    }

    @Scheduled(every = "${grantwell.auth.purge-interval:15m}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void purgeExpired() {
        try {
            tokenStore.purgeExpired(clock.instant());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Error purging expired tokens");
        }
    }
}
