package io.github.shiftlog.workforce.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;

@Data
@ConfigurationProperties(prefix = "workforce")
public class WorkforceProperties {

    /** Zone whose calendar months define rating periods. */
    private String zone = "UTC";

    private Invite invite = new Invite();
    private Monitor monitor = new Monitor();
    private Rating rating = new Rating();

    public ZoneId getZoneId() {
        return ZoneId.of(zone);
    }

    @Data
    public static class Invite {
        /** Unused invites older than this are removed by the cleanup job. */
        private Duration retention = Duration.ofDays(7);
        private int codeBytes = 16;
        private String cleanupCron = "0 0 * * * *";
    }

    @Data
    public static class Monitor {
        private boolean enabled = true;
        private Duration lateThreshold = Duration.ofMinutes(15);
        private Duration missedThreshold = Duration.ofMinutes(60);
        private Duration longBreakThreshold = Duration.ofMinutes(90);
        private Duration lookback = Duration.ofHours(24);
        private Duration interval = Duration.ofMinutes(5);
    }

    @Data
    public static class Rating {
        private BigDecimal warningBelow = BigDecimal.valueOf(80);
        private BigDecimal terminatedBelow = BigDecimal.valueOf(50);
    }
}
