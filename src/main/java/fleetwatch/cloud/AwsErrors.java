package fleetwatch.cloud;

import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;

import java.util.Set;

/**
 * Classifies AWS SDK failures into the monitor's error taxonomy.
 */
public final class AwsErrors {

    public static final String ERROR_INSTANCE_NOT_FOUND = "InvalidInstanceID.NotFound";

    private static final Set<String> NOT_FOUND_CODES = Set.of(
            ERROR_INSTANCE_NOT_FOUND,
            "InvalidInstanceID.Malformed",
            "ResourceNotFound",
            "ResourceNotFoundException");

    private static final Set<String> TRANSIENT_CODES = Set.of(
            "Throttling",
            "ThrottlingException",
            "RequestLimitExceeded",
            "ServiceUnavailable",
            "InternalFailure",
            "InternalError",
            "RequestTimeout");

    private AwsErrors() {
    }

    /** Error code of a service exception, or null */
    public static String errorCode(SdkException e) {
        if (e instanceof AwsServiceException ase && ase.awsErrorDetails() != null) {
            return ase.awsErrorDetails().errorCode();
        }
        return null;
    }

    public static boolean isNotFound(SdkException e) {
        if (e instanceof AwsServiceException ase) {
            String code = errorCode(ase);
            return (code != null && NOT_FOUND_CODES.contains(code)) || ase.statusCode() == 404;
        }
        return false;
    }

    /**
     * Throttling, 5xx and client-side (network, timeout) failures are worth retrying.
     */
    public static boolean isTransient(SdkException e) {
        if (e instanceof SdkClientException) {
            return true;
        }
        if (e instanceof AwsServiceException ase) {
            String code = errorCode(ase);
            return ase.isThrottlingException()
                    || ase.statusCode() >= 500
                    || (code != null && TRANSIENT_CODES.contains(code));
        }
        return false;
    }

    public static String describe(SdkException e) {
        String code = errorCode(e);
        return code == null ? e.getMessage() : code + ": " + e.getMessage();
    }
}
