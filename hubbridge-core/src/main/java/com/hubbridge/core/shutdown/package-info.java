/**
 * Ordered teardown: {@link com.hubbridge.core.shutdown.ShutdownCoordinator} runs the phases of
 * {@link com.hubbridge.core.shutdown.ShutdownPhase} for a {@link com.hubbridge.core.shutdown.ShutdownAction}.
 */
package com.hubbridge.core.shutdown;
