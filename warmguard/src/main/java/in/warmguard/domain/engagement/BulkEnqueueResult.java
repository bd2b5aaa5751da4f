package in.warmguard.domain.engagement;

import java.util.List;

public record BulkEnqueueResult(int added, int failed, List<String> errors) {

    public BulkEnqueueResult {
        errors = List.copyOf(errors);
    }
}
