package dev.modelkit.tracking;

import javax.annotation.Nullable;

/**
 * Implemented by every instance built through a {@link TrackedClass}. The accessors are generated;
 * tracked classes never implement this themselves.
 */
public interface ConfigTracked {
    /** The record of the completed construction, or null while construction has not finished. */
    @Nullable
    InitConfig getInitConfig();

    void setInitConfig(InitConfig initConfig);
}
