package fun.fengwk.smh.core.transport;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Live session handles keyed by session id.
 *
 * @param <T> handle type
 * @author fengwk
 */
@Slf4j
public class SessionRegistry<T> {

    private final Map<String, T> handles = new ConcurrentHashMap<>();
    private final Supplier<String> idGenerator;

    public SessionRegistry() {
        this(() -> UUID.randomUUID().toString());
    }

    public SessionRegistry(Supplier<String> idGenerator) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    /**
     * Mint a fresh id and register the handle built for it.
     *
     * @param handleFactory builds the handle from the minted id
     * @return minted id
     * @throws IllegalStateException when the minted id collides with a live session
     */
    public String create(Function<String, ? extends T> handleFactory) {
        String id = idGenerator.get();
        if (id == null) {
            throw new IllegalStateException("session id generator returned null");
        }
        T handle = Objects.requireNonNull(handleFactory.apply(id), "handle");
        if (handles.putIfAbsent(id, handle) != null) {
            throw new IllegalStateException("session id collision: " + id);
        }
        log.debug("session registered, sessionId={}, activeSessions={}", id, handles.size());
        return id;
    }

    public Optional<T> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handles.get(id));
    }

    /**
     * Unknown ids are ignored.
     */
    public void remove(String id) {
        if (id != null && handles.remove(id) != null) {
            log.debug("session unregistered, sessionId={}, activeSessions={}", id, handles.size());
        }
    }

    public int size() {
        return handles.size();
    }

    /**
     * Snapshot of the live handles.
     */
    public List<T> handles() {
        return new ArrayList<>(handles.values());
    }

    public void clear() {
        handles.clear();
    }

}
