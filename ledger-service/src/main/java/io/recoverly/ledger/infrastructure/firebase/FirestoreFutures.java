package io.recoverly.ledger.infrastructure.firebase;

import com.google.api.core.ApiFuture;
import io.recoverly.common.exception.StorageException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutionException;

/**
 * Blocking access to Firestore futures for reads that must not degrade to "no data".
 *
 * Ledger mutations rebuild allocations and statuses from what they read, so
 * a failed read surfaces as StorageException instead of an empty result.
 */
@Slf4j
public final class FirestoreFutures {

    private FirestoreFutures() {
        // Utility class - no instantiation
    }

    /**
     * Wait for a Firestore call.
     *
     * @param operation   operation name reported in the exception
     * @param description what was being read, for logs and the exception message
     */
    public static <T> T await(ApiFuture<T> future, String operation, String description) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            log.error("Interrupted while reading {}", description);
            Thread.currentThread().interrupt();
            throw new StorageException(operation, "Interrupted while reading " + description, e);
        } catch (ExecutionException e) {
            log.error("Error reading {}: {}", description, e.getMessage());
            throw new StorageException(operation, "Failed to read " + description, e);
        }
    }
}
