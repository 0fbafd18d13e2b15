package com.titan.prepress.storage;

import java.util.UUID;

public interface InputAdapter {

    /**
     * @throws com.titan.prepress.service.PrepressException with code {@code INPUT_MISSING}
     *         when nothing was uploaded for the job
     */
    byte[] fetchInput(UUID jobId);
}
