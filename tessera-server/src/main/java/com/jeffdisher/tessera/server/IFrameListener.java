package com.jeffdisher.tessera.server;

import java.util.List;

import com.jeffdisher.tessera.kernel.ApplyResult;
import com.jeffdisher.tessera.kernel.FrameContext;


/**
 * Called on the kernel thread after each frame's transactions have been applied.
 */
public interface IFrameListener
{
	void frameCompleted(FrameContext context, List<ApplyResult> results);
}
