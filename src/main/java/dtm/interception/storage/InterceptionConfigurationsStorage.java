package dtm.interception.storage;

import dtm.interception.configurations.InterceptionConfigurations;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Properties;

@Slf4j
@Builder(toBuilder = true)
public class InterceptionConfigurationsStorage implements InterceptionConfigurations {

    public static final String PREFIX = "kernon.interception.";
    public static final String ATTACH_HOOK_ERRORS_AS_SUPPRESSED = PREFIX + "attach-hook-errors-as-suppressed";
    public static final String CACHE_RESOLVED_INTERCEPTORS = PREFIX + "cache-resolved-interceptors";
    public static final String DEDUPLICATE_INTERCEPTORS = PREFIX + "deduplicate-interceptors";
    public static final String LOG_HOOK_ERRORS = PREFIX + "log-hook-errors";

    @Builder.Default
    private final boolean attachHookErrorsAsSuppressed = false;
    @Builder.Default
    private final boolean cacheResolvedInterceptors = true;
    @Builder.Default
    private final boolean deduplicateInterceptors = true;
    @Builder.Default
    private final boolean logHookErrors = true;

    public static InterceptionConfigurationsStorage defaults() {
        return builder().build();
    }

    public static InterceptionConfigurationsStorage fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    public static InterceptionConfigurationsStorage fromProperties(@NonNull Properties properties) {
        InterceptionConfigurations defaults = new InterceptionConfigurations() {};
        return builder()
                .attachHookErrorsAsSuppressed(readBoolean(properties, ATTACH_HOOK_ERRORS_AS_SUPPRESSED, defaults.isAttachHookErrorsAsSuppressed()))
                .cacheResolvedInterceptors(readBoolean(properties, CACHE_RESOLVED_INTERCEPTORS, defaults.isCacheResolvedInterceptors()))
                .deduplicateInterceptors(readBoolean(properties, DEDUPLICATE_INTERCEPTORS, defaults.isDeduplicateInterceptors()))
                .logHookErrors(readBoolean(properties, LOG_HOOK_ERRORS, defaults.isLogHookErrors()))
                .build();
    }

    private static boolean readBoolean(Properties properties, String key, boolean defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;

        String value = raw.trim();
        if (value.equalsIgnoreCase("true")) return true;
        if (value.equalsIgnoreCase("false")) return false;

        log.warn("Valor inválido para '{}': '{}'. Usando padrão: {}", key, raw, defaultValue);
        return defaultValue;
    }

    @Override
    public boolean isAttachHookErrorsAsSuppressed() {
        return attachHookErrorsAsSuppressed;
    }

    @Override
    public boolean isCacheResolvedInterceptors() {
        return cacheResolvedInterceptors;
    }

    @Override
    public boolean isDeduplicateInterceptors() {
        return deduplicateInterceptors;
    }

    @Override
    public boolean isLogHookErrors() {
        return logHookErrors;
    }

}
