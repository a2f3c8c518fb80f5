package broker.core.service.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.stream.Stream;

import jakarta.enterprise.inject.Instance;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import broker.core.config.SessionConfig;
import broker.core.port.out.KeyValueStore;
import broker.spi.StorageProvider;
import broker.support.TestConfigs;

@DisplayName("StorageProviderRegistry")
class StorageProviderRegistryTest {

    private SessionConfig config;
    private StorageProvider redis;
    private StorageProvider memory;
    private Instance<StorageProvider> instance;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        config = TestConfigs.sessionConfig();
        redis = provider("redis", 100);
        memory = provider("memory", 0);
        instance = mock(Instance.class);
        when(instance.stream()).thenAnswer(inv -> Stream.of(redis, memory));
    }

    private static StorageProvider provider(String name, int priority) {
        var store = mock(KeyValueStore.class);
        var provider = mock(StorageProvider.class);
        when(provider.name()).thenReturn(name);
        when(provider.priority()).thenReturn(priority);
        when(provider.isAvailable()).thenReturn(true);
        when(provider.createStore()).thenReturn(store);
        return provider;
    }

    @Test
    @DisplayName("should select the configured provider without checking the others")
    void shouldSelectConfiguredProvider() {
        when(config.storage().provider()).thenReturn("memory");
        var registry = new StorageProviderRegistry(instance, config);

        assertSame(memory, registry.getSelectedProvider());
        verify(redis, never()).isAvailable();
    }

    @Test
    @DisplayName("should fall back to the highest priority available provider")
    void shouldFallBackByPriority() {
        when(config.storage().provider()).thenReturn("dynamodb");
        var registry = new StorageProviderRegistry(instance, config);

        assertSame(redis, registry.getSelectedProvider());
    }

    @Test
    @DisplayName("should fall back to memory when the configured provider is unavailable")
    void shouldFallBackToMemory() {
        when(config.storage().provider()).thenReturn("redis");
        when(redis.isAvailable()).thenReturn(false);
        var registry = new StorageProviderRegistry(instance, config);

        assertEquals("memory", registry.getSelectedProvider().name());
    }

    @Test
    @DisplayName("should create the store once")
    void shouldCreateStoreOnce() {
        when(config.storage().provider()).thenReturn("memory");
        var registry = new StorageProviderRegistry(instance, config);

        assertSame(registry.getStore(), registry.getStore());
        verify(memory, times(1)).createStore();
    }

    @Test
    @DisplayName("should fail when no provider is available")
    void shouldFailWithoutProviders() {
        when(instance.stream()).thenAnswer(inv -> Stream.empty());
        var registry = new StorageProviderRegistry(instance, config);

        assertThrows(IllegalStateException.class, registry::getSelectedProvider);
    }
}
