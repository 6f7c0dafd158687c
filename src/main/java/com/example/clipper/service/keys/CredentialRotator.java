package com.example.clipper.service.keys;

import com.example.clipper.NoCredentialsAvailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one API key per call, cycling through each service's pool so load spreads evenly across keys.
 * Pools are loaded once per service and kept until {@link #clearCache(String)} is called.
 */
@Component
public class CredentialRotator {
    private static final Logger LOGGER = LoggerFactory.getLogger(CredentialRotator.class);

    private final KeyPoolLoader loader;
    private final Map<String, List<String>> pools = new ConcurrentHashMap<>();
    private final Map<String, RotationCursor> cursors = new ConcurrentHashMap<>();

    public CredentialRotator(KeyPoolLoader loader) {
        this.loader = loader;
    }

    /**
     * Returns the key under the service's cursor and moves the cursor on, wrapping after the last key.
     *
     * @param service service name, e.g. {@code github}.
     * @return the key to use for the next call.
     * @throws NoCredentialsAvailableException when neither the key file nor the environment provides a key.
     */
    public String getNext(String service) {
        List<String> keys = pool(service);
        if (keys.isEmpty()) {
            throw new NoCredentialsAvailableException(service, loader.keyFile(service).toString(), loader.envVar(service));
        }
        int index = cursors.computeIfAbsent(service, s -> new RotationCursor()).next(keys.size());
        LOGGER.debug("Key rotation service={} index={} poolSize={}", service, index, keys.size());
        return keys.get(index);
    }

    public List<String> getAll(String service) {
        return pool(service);
    }

    public int getCount(String service) {
        return pool(service).size();
    }

    public boolean has(String service) {
        return !pool(service).isEmpty();
    }

    public void resetRotation(String service) {
        RotationCursor cursor = cursors.get(service);
        if (cursor != null) {
            cursor.reset();
        }
    }

    public void clearCache(String service) {
        pools.remove(service);
    }

    public void clearCache() {
        pools.clear();
    }

    private List<String> pool(String service) {
        return pools.computeIfAbsent(service, loader::load);
    }
}
