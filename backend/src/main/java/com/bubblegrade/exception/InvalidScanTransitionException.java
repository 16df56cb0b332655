package com.bubblegrade.exception;

import com.bubblegrade.modules.scan.ScanStatus;
import lombok.Getter;

@Getter
public class InvalidScanTransitionException extends RuntimeException {

    private final String scanId;
    private final ScanStatus from;
    private final ScanStatus to;

    public InvalidScanTransitionException(String scanId, ScanStatus from, ScanStatus to) {
        super("Scan " + scanId + " cannot move from " + from.getValue() + " to " + to.getValue());
        this.scanId = scanId;
        this.from = from;
        this.to = to;
    }

    public InvalidScanTransitionException(String scanId, ScanStatus from, String action) {
        super("Scan " + scanId + " in status " + from.getValue() + " cannot be " + action);
        this.scanId = scanId;
        this.from = from;
        this.to = null;
    }
}
