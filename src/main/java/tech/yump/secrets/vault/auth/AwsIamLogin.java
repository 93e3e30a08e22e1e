package tech.yump.secrets.vault.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.signer.Aws4Signer;
import software.amazon.awssdk.auth.signer.params.Aws4SignerParams;
import software.amazon.awssdk.http.SdkHttpFullRequest;
import software.amazon.awssdk.http.SdkHttpMethod;
import software.amazon.awssdk.regions.Region;
import tech.yump.secrets.vault.VaultConfigurationException;
import tech.yump.secrets.vault.VaultHttpClient;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Logs in through Vault's AWS auth method using a SigV4-signed {@code sts:GetCallerIdentity} request.
 * The request is signed locally and handed to Vault, which forwards it to STS to prove the caller's identity.
 */
@Slf4j
public final class AwsIamLogin implements VaultLoginStrategy {

    static final String REQUEST_BODY = "Action=GetCallerIdentity&Version=2011-06-15";
    static final String CONTENT_TYPE = "application/x-www-form-urlencoded; charset=utf-8";
    static final String IAM_SERVER_ID_HEADER = "X-Vault-AWS-IAM-Server-ID";
    private static final String SIGNING_NAME = "sts";

    private final String role;
    private final String mountPoint;
    private final Region region;
    private final String stsUrl;
    private final String iamServerId;
    private final AwsCredentialsProvider credentialsProvider;
    private final ObjectMapper objectMapper;
    private final Aws4Signer signer = Aws4Signer.create();

    public AwsIamLogin(String role, String mountPoint, String region, String stsEndpoint, String iamServerId,
                       ObjectMapper objectMapper) {
        this(role, mountPoint, region, stsEndpoint, iamServerId, DefaultCredentialsProvider.create(), objectMapper);
    }

    public AwsIamLogin(String role, String mountPoint, String region, String stsEndpoint, String iamServerId,
                       AwsCredentialsProvider credentialsProvider, ObjectMapper objectMapper) {
        if (role == null || role.isBlank()) {
            throw new VaultConfigurationException("AWS role is required for AWS IAM authentication.");
        }
        this.role = role;
        this.mountPoint = mountPoint;
        this.region = Region.of(region);
        this.stsUrl = stsEndpoint.endsWith("/") ? stsEndpoint : stsEndpoint + "/";
        this.iamServerId = iamServerId == null || iamServerId.isBlank() ? null : iamServerId;
        this.credentialsProvider = credentialsProvider;
        this.objectMapper = objectMapper;
    }

    @Override
    public VaultAuthMethod method() {
        return VaultAuthMethod.AWS;
    }

    @Override
    public String login(VaultHttpClient httpClient) {
        ObjectNode body = buildLoginPayload(credentialsProvider.resolveCredentials());
        JsonNode response = httpClient.login(mountPoint, body);
        String clientToken = LoginResponses.clientToken(response);
        log.info("Authenticated to Vault via AWS IAM auth (role={}, region={}, mountPoint={})", role, region, mountPoint);
        return clientToken;
    }

    ObjectNode buildLoginPayload(AwsCredentials credentials) {
        byte[] bodyBytes = REQUEST_BODY.getBytes(StandardCharsets.UTF_8);

        SdkHttpFullRequest.Builder unsigned = SdkHttpFullRequest.builder()
                .method(SdkHttpMethod.POST)
                .uri(URI.create(stsUrl))
                .putHeader("Content-Type", CONTENT_TYPE)
                .contentStreamProvider(() -> new ByteArrayInputStream(bodyBytes));
        if (iamServerId != null) {
            unsigned.putHeader(IAM_SERVER_ID_HEADER, iamServerId);
        }

        Aws4SignerParams params = Aws4SignerParams.builder()
                .awsCredentials(credentials)
                .signingName(SIGNING_NAME)
                .signingRegion(region)
                .build();
        SdkHttpFullRequest signed = signer.sign(unsigned.build(), params);

        ObjectNode headers = objectMapper.createObjectNode();
        for (Map.Entry<String, List<String>> header : signed.headers().entrySet()) {
            headers.put(header.getKey(), String.join(",", header.getValue()));
        }

        Base64.Encoder encoder = Base64.getEncoder();
        return objectMapper.createObjectNode()
                .put("role", role)
                .put("iam_http_request_method", "POST")
                .put("iam_request_url", encoder.encodeToString(stsUrl.getBytes(StandardCharsets.UTF_8)))
                .put("iam_request_body", encoder.encodeToString(bodyBytes))
                .put("iam_request_headers", encoder.encodeToString(headers.toString().getBytes(StandardCharsets.UTF_8)));
    }

    public String role() {
        return role;
    }

    public String mountPoint() {
        return mountPoint;
    }
}
