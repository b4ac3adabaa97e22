package com.panelkit.app.config;

import com.panelkit.app.platform.DetachedPlatformClient;
import com.panelkit.common.config.ConfigPaths;
import com.panelkit.common.config.ConfigService;
import com.panelkit.common.config.PanelKitConfig;
import com.panelkit.common.logging.SubsystemLogger;
import com.panelkit.panel.broadcast.JsonLinesIpcChannel;
import com.panelkit.panel.broadcast.PanelBroadcaster;
import com.panelkit.panel.definition.DefaultPermissionEvaluator;
import com.panelkit.panel.definition.PanelDefinition;
import com.panelkit.panel.definition.PanelRegistry;
import com.panelkit.panel.directory.DirectoryInteractionHandler;
import com.panelkit.panel.directory.PanelDirectory;
import com.panelkit.panel.navigation.NavigationContextStore;
import com.panelkit.panel.persistent.PersistentPanelService;
import com.panelkit.panel.platform.PlatformClient;
import com.panelkit.panel.platform.UserDirectory;
import com.panelkit.panel.recovery.PanelRecoveryManager;
import com.panelkit.panel.router.PanelRouter;
import com.panelkit.panel.router.PersistentWarningHandler;
import com.panelkit.panel.serialize.MentionResolver;
import com.panelkit.panel.store.PanelInstanceStore;
import com.panelkit.panel.web.PanelWebAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;

/**
 * Spring wiring for the panel core.
 *
 * <p>A chat transport plugs in by exposing a {@link PlatformClient} bean (and optionally
 * a {@link UserDirectory}); without one the app runs web-mirror only.
 */
@Slf4j
@Configuration
public class PanelBeanConfig {

    @Value("${panelkit.config.path:}")
    private String configPath;

    private PlatformClient detached;

    @Bean
    public ConfigService configService() {
        Path resolved = configPath == null || configPath.isBlank()
                ? ConfigPaths.resolveConfigPath()
                : ConfigPaths.resolveUserPath(configPath, System.getProperty("user.home"));
        ConfigService service = new ConfigService(resolved);
        applyLogging(service.loadConfig());
        return service;
    }

    static void applyLogging(PanelKitConfig config) {
        PanelKitConfig.LoggingConfig logging = config.getLogging();
        SubsystemLogger.configure(logging.getLevel(), logging.getSubsystems());
        List<String> subsystems = logging.getSubsystems();
        log.info("Panel logging level {}, subsystems {}", logging.getLevel(),
                subsystems == null || subsystems.isEmpty() ? "all" : subsystems);
    }

    @Bean
    public PanelRegistry panelRegistry(List<PanelDefinition> panels) {
        PanelRegistry registry = new PanelRegistry();
        panels.forEach(registry::register);
        log.info("Registered {} panels", registry.size());
        return registry;
    }

    @Bean(destroyMethod = "close")
    public NavigationContextStore navigationContextStore(ConfigService configService) {
        PanelKitConfig.NavigationConfig config = configService.loadConfig().getNavigation();
        NavigationContextStore store = new NavigationContextStore(
                config.getTtlMs(), config.getSweepIntervalMs(), System::currentTimeMillis);
        store.start();
        return store;
    }

    @Bean
    public PanelInstanceStore panelInstanceStore(ConfigService configService) {
        String dataDir = configService.loadConfig().getStorage().getDataDir();
        return new PanelInstanceStore(ConfigPaths.resolveUserPath(dataDir, System.getProperty("user.home")));
    }

    @Bean
    public PanelBroadcaster panelBroadcaster() {
        return new PanelBroadcaster();
    }

    /**
     * Mirrors live updates to stdout as JSON lines when a parent process drives this one.
     */
    @Bean
    @ConditionalOnProperty(name = "panelkit.ipc.stdout", havingValue = "true")
    public JsonLinesIpcChannel stdoutLiveUpdateChannel(PanelBroadcaster broadcaster) {
        JsonLinesIpcChannel channel = new JsonLinesIpcChannel(System.out);
        broadcaster.addChannel(channel);
        log.info("Live updates mirrored to stdout");
        return channel;
    }

    @Bean
    public DefaultPermissionEvaluator permissionEvaluator(ConfigService configService) {
        return new DefaultPermissionEvaluator(
                () -> new HashSet<>(configService.loadConfig().getPermissions().getDevs()),
                () -> configService.loadConfig().getPermissions().getMainGuildId());
    }

    @Bean
    public PersistentPanelService persistentPanelService(ObjectProvider<PlatformClient> platformClient,
            PanelInstanceStore instanceStore, NavigationContextStore navigation, PanelBroadcaster broadcaster) {
        return new PersistentPanelService(transport(platformClient), instanceStore, navigation, broadcaster);
    }

    @Bean
    public PanelRouter panelRouter(PanelRegistry registry, NavigationContextStore navigation,
            PersistentPanelService persistent, DefaultPermissionEvaluator permissions, ConfigService configService) {
        return new PanelRouter(registry, navigation, persistent, permissions,
                configService.loadConfig().getRouter().getAckDeadlineMs());
    }

    @Bean
    public PersistentWarningHandler persistentWarningHandler(PanelRegistry registry,
            PersistentPanelService persistent, DefaultPermissionEvaluator permissions) {
        return new PersistentWarningHandler(registry, persistent, permissions);
    }

    @Bean
    public PanelDirectory panelDirectory(PanelRegistry registry, DefaultPermissionEvaluator permissions,
            ConfigService configService) {
        return new PanelDirectory(registry, permissions, configService.loadConfig().getAdminPanel());
    }

    @Bean
    public DirectoryInteractionHandler directoryInteractionHandler(PanelDirectory directory, PanelRouter router,
            NavigationContextStore navigation) {
        return new DirectoryInteractionHandler(directory, router, navigation);
    }

    @Bean
    public PanelWebAdapter panelWebAdapter(PanelRegistry registry, PanelDirectory directory,
            DefaultPermissionEvaluator permissions, PanelBroadcaster broadcaster,
            ObjectProvider<UserDirectory> userDirectory) {
        UserDirectory users = userDirectory.getIfAvailable();
        return new PanelWebAdapter(registry, directory, permissions, broadcaster,
                users != null ? new MentionResolver(users) : null);
    }

    @Bean
    public PanelRecoveryManager panelRecoveryManager(ObjectProvider<PlatformClient> platformClient,
            PersistentPanelService persistent, NavigationContextStore navigation, PanelRegistry registry) {
        return new PanelRecoveryManager(transport(platformClient), persistent, navigation, registry);
    }

    private PlatformClient transport(ObjectProvider<PlatformClient> provider) {
        PlatformClient client = provider.getIfAvailable();
        if (client != null) {
            return client;
        }
        if (detached == null) {
            log.warn("No chat transport configured; persistent panels stay on disk until one connects");
            detached = new DetachedPlatformClient();
        }
        return detached;
    }
}
