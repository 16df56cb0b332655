package com.bubblegrade.modules.storage;

/**
 * Where uploaded sheet images are put for the vision worker to read.
 */
public interface ScanImageStore {

    /**
     * Stores the image and returns the path to put on the job, relative to the
     * directory shared with the worker.
     */
    String store(byte[] image);

    /** Removes an image nothing refers to any more. Missing images are ignored. */
    void delete(String imagePath);
}
