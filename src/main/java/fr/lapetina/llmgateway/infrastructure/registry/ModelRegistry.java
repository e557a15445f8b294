package fr.lapetina.llmgateway.infrastructure.registry;

import fr.lapetina.llmgateway.domain.exception.ModelNotFoundException;
import fr.lapetina.llmgateway.domain.exception.ValidationException;
import fr.lapetina.llmgateway.domain.model.ModelCapability;
import fr.lapetina.llmgateway.domain.model.ModelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Registry of routable models.
 *
 * Thread-safe. Insertion order is preserved and is the tie-breaker of every
 * routing policy, so the backing map is a {@link LinkedHashMap} guarded by a
 * read/write lock. Readers always get a snapshot copy.
 */
public final class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final Map<String, ModelConfig> models = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Consumer<ModelRegistryEvent>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Adds a new model.
     *
     * @throws ValidationException if the id is blank or already registered,
     *                             or the model declares no capability
     */
    public void add(ModelConfig config) {
        if (config.getId().isBlank()) {
            throw new ValidationException("Model ID must not be blank");
        }
        if (config.getCapabilities().isEmpty()) {
            throw new ValidationException("Model " + config.getId() + " must declare at least one capability");
        }

        lock.writeLock().lock();
        try {
            if (models.containsKey(config.getId())) {
                throw new ValidationException("Model already registered: " + config.getId());
            }
            models.put(config.getId(), config);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Model registered: {}", config);
        notifyListeners(new ModelRegistryEvent(ModelRegistryEvent.Type.ADDED, config));
    }

    /**
     * Removes a model by ID.
     *
     * @return false if no model with this ID was registered
     */
    public boolean remove(String modelId) {
        ModelConfig removed;
        lock.writeLock().lock();
        try {
            removed = models.remove(modelId);
        } finally {
            lock.writeLock().unlock();
        }

        if (removed == null) {
            return false;
        }
        log.info("Model removed: {}", removed);
        notifyListeners(new ModelRegistryEvent(ModelRegistryEvent.Type.REMOVED, removed));
        return true;
    }

    public ModelConfig enable(String modelId) {
        return setEnabled(modelId, true);
    }

    public ModelConfig disable(String modelId) {
        return setEnabled(modelId, false);
    }

    private ModelConfig setEnabled(String modelId, boolean enabled) {
        ModelConfig previous;
        ModelConfig updated;
        lock.writeLock().lock();
        try {
            previous = models.get(modelId);
            if (previous == null) {
                throw new ModelNotFoundException(modelId);
            }
            updated = previous.withEnabled(enabled);
            models.put(modelId, updated);
        } finally {
            lock.writeLock().unlock();
        }

        if (previous != updated) {
            log.info("Model {}: modelId={}", enabled ? "enabled" : "disabled", modelId);
            notifyListeners(new ModelRegistryEvent(ModelRegistryEvent.Type.UPDATED, updated));
        }
        return updated;
    }

    /**
     * Gets a model by ID, enabled or not.
     */
    public Optional<ModelConfig> get(String modelId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(models.get(modelId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the registered models in insertion order.
     *
     * @param enabledOnly whether disabled models are left out
     */
    public List<ModelConfig> list(boolean enabledOnly) {
        lock.readLock().lock();
        try {
            List<ModelConfig> result = new ArrayList<>(models.size());
            for (ModelConfig model : models.values()) {
                if (!enabledOnly || model.isEnabled()) {
                    result.add(model);
                }
            }
            return List.copyOf(result);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Gets enabled models carrying a capability, in insertion order.
     */
    public List<ModelConfig> findByCapability(ModelCapability capability) {
        return list(true).stream()
                .filter(model -> model.hasCapability(capability))
                .toList();
    }

    public int size() {
        lock.readLock().lock();
        try {
            return models.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Adds a listener for registry events.
     */
    public void addListener(Consumer<ModelRegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<ModelRegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(ModelRegistryEvent event) {
        for (Consumer<ModelRegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying listener: event={}", event.type(), e);
            }
        }
    }

    /**
     * Event for registry changes.
     */
    public record ModelRegistryEvent(Type type, ModelConfig model) {
        public enum Type {
            ADDED,
            REMOVED,
            UPDATED
        }
    }
}
