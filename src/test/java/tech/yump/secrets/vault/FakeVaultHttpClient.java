package tech.yump.secrets.vault;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory Vault for tests. Reads return {@code {"data": <written payload>}}, which matches the real
 * response shape for both KV versions. Failures can be queued for the next non-login calls.
 */
public class FakeVaultHttpClient implements VaultHttpClient {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, JsonNode> store = new LinkedHashMap<>();
    private final Deque<Integer> failures = new ArrayDeque<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final List<String> tokensSeen = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger logins = new AtomicInteger();
    private final Deque<Integer> loginFailures = new ArrayDeque<>();
    private volatile long loginDelayMillis;

    public FakeVaultHttpClient failNext(int... statuses) {
        for (int status : statuses) {
            failures.add(status);
        }
        return this;
    }

    public FakeVaultHttpClient failNextLogin(int status) {
        loginFailures.add(status);
        return this;
    }

    public FakeVaultHttpClient loginDelay(long millis) {
        this.loginDelayMillis = millis;
        return this;
    }

    /**
     * Seeds a KV v2 secret at {@code path} holding {@code data}.
     */
    public void putKvV2(String path, Map<String, String> data) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("data", objectMapper.valueToTree(data));
        store.put(path, payload);
    }

    public void putKvV1(String path, Map<String, String> data) {
        store.put(path, objectMapper.valueToTree(data));
    }

    public JsonNode stored(String path) {
        return store.get(path);
    }

    public Set<String> storedPaths() {
        return new LinkedHashSet<>(store.keySet());
    }

    public List<String> calls() {
        return List.copyOf(calls);
    }

    public long callCount(String prefix) {
        return calls().stream().filter(c -> c.startsWith(prefix)).count();
    }

    public List<String> tokensSeen() {
        return List.copyOf(tokensSeen);
    }

    public int loginCount() {
        return logins.get();
    }

    @Override
    public JsonNode read(String path, String token) {
        record("READ " + path, token);
        JsonNode payload = store.get(path);
        if (payload == null) {
            throw notFound(path);
        }
        ObjectNode response = objectMapper.createObjectNode();
        response.set("data", payload.deepCopy());
        return response;
    }

    @Override
    public JsonNode write(String path, JsonNode body, String token) {
        record("WRITE " + path, token);
        store.put(path, body.deepCopy());
        return MissingNode.getInstance();
    }

    @Override
    public void delete(String path, String token) {
        record("DELETE " + path, token);
        store.remove(path);
        store.remove(toData(path));
    }

    @Override
    public JsonNode list(String path, String token) {
        record("LIST " + path, token);
        String prefix = toData(path).replaceAll("/+$", "") + "/";
        Set<String> keys = new LinkedHashSet<>();
        for (String stored : store.keySet()) {
            if (stored.startsWith(prefix)) {
                String rest = stored.substring(prefix.length());
                int slash = rest.indexOf('/');
                keys.add(slash < 0 ? rest : rest.substring(0, slash + 1));
            }
        }
        if (keys.isEmpty()) {
            throw notFound(path);
        }
        ObjectNode response = objectMapper.createObjectNode();
        ArrayNode keyArray = response.putObject("data").putArray("keys");
        keys.forEach(keyArray::add);
        return response;
    }

    @Override
    public JsonNode login(String mountPoint, JsonNode body) {
        if (loginDelayMillis > 0) {
            try {
                Thread.sleep(loginDelayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        calls.add("LOGIN " + mountPoint);
        Integer failure;
        synchronized (loginFailures) {
            failure = loginFailures.poll();
        }
        if (failure != null) {
            throw new VaultResponseException(failure, "login failed", List.of("permission denied"));
        }
        int n = logins.incrementAndGet();
        ObjectNode response = objectMapper.createObjectNode();
        response.putObject("auth").put("client_token", "token-" + n);
        return response;
    }

    private void record(String call, String token) {
        calls.add(call);
        tokensSeen.add(token);
        Integer failure;
        synchronized (failures) {
            failure = failures.poll();
        }
        if (failure != null) {
            throw new VaultResponseException(failure, "injected failure " + failure, List.of("injected"));
        }
    }

    private static VaultResponseException notFound(String path) {
        return new VaultResponseException(404, "not found: " + path, List.of());
    }

    private static String toData(String path) {
        int idx = path.indexOf("/metadata/");
        if (idx < 0) {
            return path;
        }
        return path.substring(0, idx) + "/data/" + path.substring(idx + "/metadata/".length());
    }
}
