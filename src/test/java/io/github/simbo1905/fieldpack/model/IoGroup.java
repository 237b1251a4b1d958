// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.fieldpack.model;

import io.github.simbo1905.fieldpack.Extension;
import io.github.simbo1905.fieldpack.FieldSchema;
import io.github.simbo1905.fieldpack.TypeHandlers;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class IoGroup {
  public static final FieldSchema<IoGroup> SCHEMA = FieldSchema.builder(IoGroup.class, IoGroup::new)
      .field("Name", String.class, IoGroup::getName, IoGroup::setName)
      .field("TimeRecorded", TypeHandlers.uint64(), IoGroup::getTimeRecorded, IoGroup::setTimeRecorded)
      .field("Fail", Boolean.class, IoGroup::isFail, IoGroup::setFail)
      .field("IOs", TypeHandlers.list(TypeHandlers.composite(Io.SCHEMA)), IoGroup::getIos, IoGroup::setIos)
      .field("Errors", TypeHandlers.list(TypeHandlers.composite(IoError.SCHEMA)), IoGroup::getErrors,
          IoGroup::setErrors)
      .field("Status", TypeHandlers.extension(1), IoGroup::getStatusExtension, IoGroup::setStatusExtension)
      .build();

  private String name = "";
  private long timeRecorded;
  private boolean fail;
  private List<Io> ios = new ArrayList<>();
  private List<IoError> errors = new ArrayList<>();
  private Extension statusExtension = Extension.of(IoStatus.EXTENSION_TYPE, 1);

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public long getTimeRecorded() {
    return timeRecorded;
  }

  public void setTimeRecorded(long timeRecorded) {
    this.timeRecorded = timeRecorded;
  }

  public boolean isFail() {
    return fail;
  }

  public void setFail(boolean fail) {
    this.fail = fail;
  }

  public List<Io> getIos() {
    return ios;
  }

  public void setIos(List<Io> ios) {
    this.ios = ios;
  }

  public List<IoError> getErrors() {
    return errors;
  }

  public void setErrors(List<IoError> errors) {
    this.errors = errors;
  }

  public Extension getStatusExtension() {
    return statusExtension;
  }

  public void setStatusExtension(Extension statusExtension) {
    this.statusExtension = statusExtension;
  }

  public IoStatus getStatus() {
    return IoStatus.fromCode(statusExtension.data()[0]);
  }

  public void setStatus(IoStatus status) {
    statusExtension = new Extension((byte) IoStatus.EXTENSION_TYPE, new byte[]{(byte) status.ordinal()});
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof IoGroup other)) return false;
    return timeRecorded == other.timeRecorded && fail == other.fail && name.equals(other.name) &&
        ios.equals(other.ios) && errors.equals(other.errors) && statusExtension.equals(other.statusExtension);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, timeRecorded, fail, ios, errors, statusExtension);
  }

  @Override
  public String toString() {
    return "IoGroup{name='" + name + "', timeRecorded=" + Long.toUnsignedString(timeRecorded) + ", fail=" + fail +
        ", status=" + getStatus() + ", ios=" + ios + ", errors=" + errors + "}";
  }
}
