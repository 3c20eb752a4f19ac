package ai.convoy.scheduler.lifecycle;

import ai.convoy.scheduler.configs.ServiceConfig;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Timer;
import java.util.TimerTask;

/**
 * Periodically expires leases whose renewal deadline has passed.
 */
@Singleton
public class LeaseExpirationCollector extends TimerTask {
    private static final Logger LOG = LogManager.getLogger(LeaseExpirationCollector.class);

    private final LeaseLifecycleManager lifecycle;
    private final Timer timer = new Timer("lease-expiration-timer", true);

    public LeaseExpirationCollector(LeaseLifecycleManager lifecycle, ServiceConfig config) {
        this.lifecycle = lifecycle;

        var period = config.getExpirationPeriod().toMillis();
        timer.scheduleAtFixedRate(this, period, period);
    }

    @Override
    public void run() {
        try {
            int expired = lifecycle.expireOverdue();
            if (expired > 0) {
                LOG.info("Expired {} leases", expired);
            } else {
                LOG.debug("No overdue leases");
            }
        } catch (Exception e) {
            LOG.error("Error during lease expiration: {}", e.getMessage(), e);
        }
    }

    public void shutdown() {
        timer.cancel();
    }
}
