package com.recursa.core.tools;

import com.recursa.core.model.AgentFrame;
import com.recursa.core.model.FrameResult;

/**
 * Runs a freshly pushed child frame to completion and returns its result.
 */
@FunctionalInterface
public interface ChildRunner {

    FrameResult run(AgentFrame child);
}
