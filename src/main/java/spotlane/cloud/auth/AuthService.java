package spotlane.cloud.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotlane.coordinator.error.ValidationException;
import yandex.cloud.api.compute.v1.InstanceServiceGrpc.InstanceServiceBlockingStub;
import yandex.cloud.api.compute.v1.InstanceServiceGrpc;
import yandex.cloud.api.operation.OperationServiceGrpc.OperationServiceBlockingStub;
import yandex.cloud.api.operation.OperationServiceGrpc;
import yandex.cloud.sdk.ServiceFactory;
import yandex.cloud.sdk.auth.Auth;

import java.time.Duration;

/**
 * Authenticated Yandex Cloud session holding the two blocking stubs the spot
 * adapter uses. The OAuth token is read from the environment and never
 * stored in config files.
 */
public class AuthService {
    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    public static final String TOKEN_ENV = "OAUTH_TOKEN";

    private final InstanceServiceBlockingStub instances;
    private final OperationServiceBlockingStub operations;

    public AuthService() {
        this(TOKEN_ENV, Duration.ofMinutes(1));
    }

    /**
     * @throws ValidationException when {@code tokenEnv} is unset, before any
     *                             call is made
     */
    public AuthService(String tokenEnv, Duration requestTimeout) {
        if (!hasToken(tokenEnv)) {
            throw new ValidationException(tokenEnv + " environment variable is not set");
        }
        ServiceFactory factory = ServiceFactory.builder()
                .credentialProvider(Auth.oauthTokenBuilder().fromEnv(tokenEnv))
                .requestTimeout(requestTimeout)
                .build();
        this.instances = factory.create(InstanceServiceBlockingStub.class, InstanceServiceGrpc::newBlockingStub);
        this.operations = factory.create(OperationServiceBlockingStub.class, OperationServiceGrpc::newBlockingStub);
        log.debug("Yandex Cloud session ready (token from {}, timeout {}s)", tokenEnv, requestTimeout.toSeconds());
    }

    public static boolean hasToken(String tokenEnv) {
        String token = System.getenv(tokenEnv);
        return token != null && !token.isBlank();
    }

    public InstanceServiceBlockingStub instances() {
        return instances;
    }

    public OperationServiceBlockingStub operations() {
        return operations;
    }
}
