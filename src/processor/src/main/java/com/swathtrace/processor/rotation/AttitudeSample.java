package com.swathtrace.processor.rotation;

/**
 * One attitude record from the motion sensor.
 *
 * @param time UTC seconds
 * @param roll roll in degrees, positive port up
 * @param pitch pitch in degrees, positive bow up
 * @param heading heading in degrees from north
 * @param heave heave in meters, positive down
 */
public record AttitudeSample(double time, double roll, double pitch, double heading, double heave) {}
