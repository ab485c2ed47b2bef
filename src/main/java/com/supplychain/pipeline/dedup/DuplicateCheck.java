package com.supplychain.pipeline.dedup;

import com.supplychain.pipeline.domain.DuplicateReason;
import lombok.Value;

@Value
public class DuplicateCheck {

    DuplicateReason reason;
    /** Signatures of the checked event; needed to release it if the sinks fail. */
    EventSignatures signatures;

    public boolean isDuplicate() {
        return reason.isDuplicate();
    }
}
