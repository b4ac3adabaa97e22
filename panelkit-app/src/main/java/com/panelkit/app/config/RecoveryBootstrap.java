package com.panelkit.app.config;

import com.panelkit.common.config.ConfigService;
import com.panelkit.common.config.PanelKitConfig;
import com.panelkit.panel.recovery.PanelRecoveryManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Brings standing panels back once the application is ready: expired sessions are
 * dropped, records pointing at deleted messages are pruned, the rest re-attach.
 */
@Slf4j
@Component
public class RecoveryBootstrap {

    private final ConfigService configService;
    private final PanelRecoveryManager recoveryManager;

    private volatile CompletableFuture<PanelRecoveryManager.RecoveryReport> lastRun;

    public RecoveryBootstrap(ConfigService configService, PanelRecoveryManager recoveryManager) {
        this.configService = configService;
        this.recoveryManager = recoveryManager;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        PanelKitConfig config = configService.loadConfig();
        if (!config.getRecovery().isEnabled()) {
            log.info("Panel recovery disabled");
            lastRun = CompletableFuture.completedFuture(new PanelRecoveryManager.RecoveryReport(0, 0, 0));
            return;
        }
        lastRun = recoveryManager.runStartup(config.getStorage().getSessionExpiryMs())
                .whenComplete((report, error) -> {
                    if (error != null) {
                        log.error("Startup panel recovery failed: {}", error.getMessage(), error);
                    } else {
                        log.info("Startup panel recovery: {} recovered, {} pruned, {} failed",
                                report.recovered(), report.pruned(), report.failed());
                    }
                });
    }

    /**
     * The most recent startup run, or null before the application is ready.
     */
    public CompletableFuture<PanelRecoveryManager.RecoveryReport> lastRun() {
        return lastRun;
    }
}
