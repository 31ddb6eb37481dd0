package com.swathtrace.processor.service;

import com.swathtrace.processor.cast.SoundVelocityCast;

/**
 * Unit of work for one worker: a block of pings and the cast chosen for them.
 *
 * @param chunkIndex position of the chunk in its batch, used to order results
 * @param firstPing index of the chunk's first ping within its survey line
 */
public record PingChunk(int chunkIndex, int firstPing, PingLine pings, SoundVelocityCast cast) {}
