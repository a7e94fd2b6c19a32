package spotlane.cloud.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotlane.coordinator.error.ValidationException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Name-keyed registry of providers. Entries are created lazily on first use,
 * so a provider whose credentials are missing only fails when it is picked.
 */
public class ProviderRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, Supplier<? extends InferenceProvider>> factories = new ConcurrentHashMap<>();
    private final Map<String, InferenceProvider> instances = new ConcurrentHashMap<>();

    /**
     * Registry with the bundled providers: {@code runpod}, {@code skyserve},
     * {@code yandex}.
     */
    public static ProviderRegistry withDefaults() {
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(RunPodProvider.NAME, RunPodProvider::fromEnv);
        registry.register(SkyServeProvider.NAME, SkyServeProvider::new);
        registry.register(YandexSpotProvider.NAME, YandexSpotProvider::fromEnv);
        return registry;
    }

    public ProviderRegistry register(String name, Supplier<? extends InferenceProvider> factory) {
        factories.put(name, factory);
        instances.remove(name);
        return this;
    }

    /** Register an already-built provider under its own name. */
    public ProviderRegistry register(InferenceProvider provider) {
        factories.put(provider.name(), () -> provider);
        instances.put(provider.name(), provider);
        return this;
    }

    public boolean contains(String name) {
        return name != null && factories.containsKey(name);
    }

    public List<String> names() {
        return factories.keySet().stream().sorted().toList();
    }

    /**
     * @throws ValidationException for unknown names or providers that cannot
     *                             be constructed in this environment
     */
    public InferenceProvider get(String name) {
        if (!contains(name)) {
            throw new ValidationException("Unknown provider: '" + name + "'. Available: " + names());
        }
        try {
            return instances.computeIfAbsent(name, n -> {
                InferenceProvider provider = factories.get(n).get();
                log.debug("Loaded provider {}", n);
                return provider;
            });
        } catch (ValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ValidationException("Could not load provider '" + name + "': " + e.getMessage(), e);
        }
    }
}
