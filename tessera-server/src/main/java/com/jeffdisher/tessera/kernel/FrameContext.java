package com.jeffdisher.tessera.kernel;


/**
 * Describes the frame which was just started.
 * 
 * @param frame The frame number (the first frame is 1).
 * @param deltaTime The seconds since the previous frame, clamped to the configured maximum.
 * @param totalTime The sum of all clamped deltas so far.
 */
public record FrameContext(long frame, float deltaTime, double totalTime)
{
}
