package io.github.yok.cleansync.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.cleansync.exception.AuthException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link AccessTokenProvider} that reads a token from a JSON credentials file.
 *
 * <p>
 * The file must contain an {@code access_token} (or {@code token}) field, as written by
 * {@code gcloud auth print-access-token} wrappers or an external token broker. The file is read
 * once, when the provider is created, so that missing credentials fail the run before any file is
 * touched.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class CredentialsFileTokenProvider implements AccessTokenProvider {

    private final String accessToken;

    private CredentialsFileTokenProvider(String accessToken) {
        this.accessToken = accessToken;
    }

    /**
     * Loads the token from a credentials file.
     *
     * @param credentialsFile JSON credentials file
     * @param objectMapper mapper used to read the file
     * @return provider holding the token
     * @throws AuthException if the file is missing, unreadable or holds no token
     */
    public static CredentialsFileTokenProvider load(Path credentialsFile,
            ObjectMapper objectMapper) {
        if (!Files.isRegularFile(credentialsFile)) {
            throw new AuthException("Credentials file not found: " + credentialsFile);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(credentialsFile.toFile());
        } catch (IOException e) {
            throw new AuthException("Cannot read credentials file: " + credentialsFile, e);
        }
        String token = root.path("access_token").asText(root.path("token").asText(null));
        if (StringUtils.isBlank(token)) {
            if ("service_account".equals(root.path("type").asText(null))) {
                throw new AuthException("Service account key files are not accepted directly; "
                        + "provide a file with an access_token: " + credentialsFile);
            }
            throw new AuthException("No access_token in credentials file: " + credentialsFile);
        }
        log.info("Loaded access token from {}", credentialsFile);
        return new CredentialsFileTokenProvider(token.trim());
    }

    @Override
    public String getAccessToken() {
        return accessToken;
    }
}
