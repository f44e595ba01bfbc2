package it.autograph.asn1;

import java.util.List;

public record WalkResult(int elementCount, List<WalkFailure> failures) {

    public WalkResult {
        failures = List.copyOf(failures);
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
