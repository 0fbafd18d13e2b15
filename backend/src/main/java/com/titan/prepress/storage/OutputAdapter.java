package com.titan.prepress.storage;

import java.util.UUID;

public interface OutputAdapter {

    void storeOutput(UUID jobId, OutputKind kind, byte[] content);
}
