package fr.lapetina.llmgateway.infrastructure.registry;

import fr.lapetina.llmgateway.domain.exception.ModelNotFoundException;
import fr.lapetina.llmgateway.domain.exception.ValidationException;
import fr.lapetina.llmgateway.domain.model.ModelCapability;
import fr.lapetina.llmgateway.domain.model.ModelConfig;
import fr.lapetina.llmgateway.domain.model.ProviderType;
import fr.lapetina.llmgateway.infrastructure.registry.ModelRegistry.ModelRegistryEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelRegistryTest {

    private ModelRegistry registry;
    private List<ModelRegistryEvent> events;

    @BeforeEach
    void setUp() {
        registry = new ModelRegistry();
        events = new CopyOnWriteArrayList<>();
        registry.addListener(events::add);
    }

    private static ModelConfig model(String id, ModelCapability... capabilities) {
        ModelConfig.Builder builder = ModelConfig.builder().id(id).provider(ProviderType.QWEN);
        for (ModelCapability capability : capabilities) {
            builder.addCapability(capability);
        }
        return builder.build();
    }

    @Nested
    @DisplayName("Adding models")
    class AddTests {

        @Test
        @DisplayName("should keep insertion order")
        void shouldKeepInsertionOrder() {
            registry.add(model("z", ModelCapability.CHAT));
            registry.add(model("a", ModelCapability.CHAT));
            registry.add(model("m", ModelCapability.CHAT));

            assertThat(registry.list(false)).extracting(ModelConfig::getId).containsExactly("z", "a", "m");
            assertThat(registry.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("should reject duplicate ids")
        void shouldRejectDuplicates() {
            registry.add(model("m", ModelCapability.CHAT));

            assertThatThrownBy(() -> registry.add(model("m", ModelCapability.CODE)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Model already registered: m");
            assertThat(registry.get("m")).get()
                    .extracting(ModelConfig::getCapabilities)
                    .isEqualTo(Set.of(ModelCapability.CHAT));
        }

        @Test
        @DisplayName("should reject blank ids and empty capabilities")
        void shouldRejectInvalidModels() {
            assertThatThrownBy(() -> registry.add(model(" ", ModelCapability.CHAT)))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> registry.add(model("m")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("capability");
            assertThat(registry.size()).isZero();
            assertThat(events).isEmpty();
        }

        @Test
        @DisplayName("should notify listeners")
        void shouldNotifyListeners() {
            ModelConfig model = model("m", ModelCapability.CHAT);

            registry.add(model);

            assertThat(events).containsExactly(new ModelRegistryEvent(ModelRegistryEvent.Type.ADDED, model));
        }
    }

    @Nested
    @DisplayName("Enabling and disabling")
    class EnableTests {

        @BeforeEach
        void addModels() {
            registry.add(model("a", ModelCapability.CHAT));
            registry.add(model("b", ModelCapability.CHAT, ModelCapability.VISION));
            events.clear();
        }

        @Test
        @DisplayName("disabled model should be hidden from enabled listings only")
        void disabledModelShouldBeHidden() {
            ModelConfig disabled = registry.disable("a");

            assertThat(disabled.isEnabled()).isFalse();
            assertThat(registry.list(true)).extracting(ModelConfig::getId).containsExactly("b");
            assertThat(registry.list(false)).extracting(ModelConfig::getId).containsExactly("a", "b");
            assertThat(registry.get("a")).get().extracting(ModelConfig::isEnabled).isEqualTo(false);
        }

        @Test
        @DisplayName("re-enabling should restore the model in place")
        void reEnableShouldKeepPosition() {
            registry.disable("a");
            registry.enable("a");

            assertThat(registry.list(true)).extracting(ModelConfig::getId).containsExactly("a", "b");
            assertThat(events).extracting(ModelRegistryEvent::type)
                    .containsExactly(ModelRegistryEvent.Type.UPDATED, ModelRegistryEvent.Type.UPDATED);
        }

        @Test
        @DisplayName("enabling an enabled model should not fire an event")
        void idempotentEnableShouldBeQuiet() {
            registry.enable("a");

            assertThat(events).isEmpty();
        }

        @Test
        @DisplayName("unknown model should fail")
        void unknownModelShouldFail() {
            assertThatThrownBy(() -> registry.disable("ghost"))
                    .isInstanceOf(ModelNotFoundException.class)
                    .hasMessageContaining("ghost");
        }

        @Test
        @DisplayName("should filter enabled models by capability")
        void shouldFindByCapability() {
            assertThat(registry.findByCapability(ModelCapability.VISION))
                    .extracting(ModelConfig::getId).containsExactly("b");

            registry.disable("b");

            assertThat(registry.findByCapability(ModelCapability.VISION)).isEmpty();
        }
    }

    @Test
    @DisplayName("remove should report whether the model existed")
    void removeShouldReportExistence() {
        ModelConfig model = model("m", ModelCapability.CHAT);
        registry.add(model);

        assertThat(registry.remove("m")).isTrue();
        assertThat(registry.remove("m")).isFalse();
        assertThat(registry.get("m")).isEmpty();
        assertThat(events).extracting(ModelRegistryEvent::type)
                .containsExactly(ModelRegistryEvent.Type.ADDED, ModelRegistryEvent.Type.REMOVED);
    }

    @Test
    @DisplayName("failing listener should not break the registry")
    void failingListenerShouldBeIsolated() {
        registry.addListener(event -> {
            throw new IllegalStateException("boom");
        });

        registry.add(model("m", ModelCapability.CHAT));

        assertThat(registry.get("m")).isPresent();
        assertThat(events).hasSize(1);
    }

    @Test
    @DisplayName("listings should be snapshots")
    void listingsShouldBeSnapshots() {
        registry.add(model("a", ModelCapability.CHAT));
        List<ModelConfig> snapshot = registry.list(false);

        registry.add(model("b", ModelCapability.CHAT));

        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(() -> snapshot.add(model("c", ModelCapability.CHAT)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("should support concurrent mutation and reads")
    void shouldBeThreadSafe() throws InterruptedException {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch latch = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            int thread = t;
            executor.submit(() -> {
                try {
                    for (int i = 0; i < 100; i++) {
                        String id = "m-" + thread + "-" + i;
                        registry.add(model(id, ModelCapability.CHAT));
                        registry.disable(id);
                        registry.list(true);
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(registry.size()).isEqualTo(800);
        assertThat(registry.list(true)).isEmpty();
    }
}
