package com.swathtrace.processor.rotation;

/** Order in which the three angle series are applied when building a rotation matrix. */
public enum RotationOrder {
  /** Roll about x, then pitch about y, then yaw about z: {@code R = Rz·Ry·Rx}. */
  RPY,
  /** The first and third series swap roles: the "roll" input is applied about z. */
  YPR
}
