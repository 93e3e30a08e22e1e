package tech.yump.secrets.vault;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link VaultHttpClient} over a Spring {@link RestTemplate}.
 * The template's request factory carries the connect and read timeouts.
 */
@Slf4j
public class RestTemplateVaultHttpClient implements VaultHttpClient {

    static final String TOKEN_HEADER = "X-Vault-Token";
    static final String NAMESPACE_HEADER = "X-Vault-Namespace";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String address;
    private final String namespace;

    public RestTemplateVaultHttpClient(RestTemplate restTemplate, ObjectMapper objectMapper, String address, String namespace) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.address = address.replaceAll("/+$", "");
        this.namespace = namespace == null || namespace.isBlank() ? null : namespace;
    }

    @Override
    public JsonNode read(String path, String token) {
        return exchange(HttpMethod.GET, uri(path, false), null, token);
    }

    @Override
    public JsonNode write(String path, JsonNode body, String token) {
        return exchange(HttpMethod.POST, uri(path, false), body, token);
    }

    @Override
    public void delete(String path, String token) {
        exchange(HttpMethod.DELETE, uri(path, false), null, token);
    }

    @Override
    public JsonNode list(String path, String token) {
        return exchange(HttpMethod.GET, uri(path, true), null, token);
    }

    @Override
    public JsonNode login(String mountPoint, JsonNode body) {
        return exchange(HttpMethod.POST, uri("auth/" + mountPoint + "/login", false), body, null);
    }

    private JsonNode exchange(HttpMethod method, URI uri, JsonNode body, String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (body != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        if (token != null) {
            headers.set(TOKEN_HEADER, token);
        }
        if (namespace != null) {
            headers.set(NAMESPACE_HEADER, namespace);
        }

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(uri, method, new HttpEntity<>(body, headers), JsonNode.class);
            return response.getBody() != null ? response.getBody() : MissingNode.getInstance();
        } catch (HttpStatusCodeException e) {
            List<String> errors = parseErrors(e.getResponseBodyAsString());
            log.debug("Vault {} {} returned {}: {}", method, uri.getPath(), e.getStatusCode().value(), errors);
            throw new VaultResponseException(e.getStatusCode().value(),
                    "Vault returned status " + e.getStatusCode().value() + " for " + method + " " + uri.getPath(), errors);
        } catch (ResourceAccessException e) {
            if (isTimeout(e)) {
                log.warn("Vault {} {} timed out", method, uri.getPath());
                throw new VaultResponseException(VaultResponseException.REQUEST_TIMEOUT,
                        "Vault request timed out: " + method + " " + uri.getPath(), e);
            }
            log.warn("Vault {} {} failed, server unreachable: {}", method, uri.getPath(), e.getMessage());
            throw new VaultResponseException(VaultResponseException.SERVICE_UNAVAILABLE,
                    "Vault is unreachable: " + method + " " + uri.getPath(), e);
        } catch (RestClientException e) {
            throw new VaultResponseException(500, "Unexpected Vault client error for " + method + " " + uri.getPath(), e);
        }
    }

    private URI uri(String path, boolean list) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(address)
                .path("/v1/")
                .path(path.replaceAll("^/+", ""));
        if (list) {
            builder.queryParam("list", "true");
        }
        return builder.build().encode().toUri();
    }

    private static boolean isTimeout(ResourceAccessException e) {
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof SocketTimeoutException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private List<String> parseErrors(String body) {
        List<String> errors = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return errors;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            node.path("errors").forEach(err -> errors.add(err.asText()));
        } catch (IOException e) {
            errors.add(body);
        }
        return errors;
    }
}
