package com.golfdraft.config;

import com.golfdraft.model.DraftOrderMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Draft scheduling and scoring defaults.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "golfdraft")
public class GolfDraftProperties {

    private Draft draft = new Draft();
    private Scoring scoring = new Scoring();

    @Getter
    @Setter
    public static class Draft {
        /**
         * How the initial pick order is built when the start request does not say.
         */
        private DraftOrderMode defaultOrderMode = DraftOrderMode.RANDOM;

        /**
         * Scheduled draft start, in days before the tournament starts.
         */
        private int autoStartLeadDays = 2;

        /**
         * Auto-start is suppressed when the tournament begins within this many hours.
         */
        private int autoStartGuardHours = 24;

        private int inviteExpiryHours = 72;
    }

    @Getter
    @Setter
    public static class Scoring {
        private BigDecimal bountyPerTier = new BigDecimal("10.00");
    }
}
