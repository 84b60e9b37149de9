package com.github.mealymachine;

import java.util.Optional;

/**
 * The occupied state of a machine: a registered state id plus its optional associated payload.
 * Instances are immutable and replaced wholesale on every fired transition, so a payload-only
 * change is still a new state.
 */
public final class State<P> {
  private final String id;
  private final P payload;

  State(final String id, final P payload) {
    this.id = id;
    this.payload = payload;
  }

  public String getId() {
    return id;
  }

  public Optional<P> getPayload() {
    return Optional.ofNullable(payload);
  }

  P rawPayload() {
    return payload;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((id == null) ? 0 : id.hashCode());
    result = prime * result + ((payload == null) ? 0 : payload.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    State<?> other = (State<?>) obj;
    if (id == null) {
      if (other.id != null) {
        return false;
      }
    } else if (!id.equals(other.id)) {
      return false;
    }
    if (payload == null) {
      if (other.payload != null) {
        return false;
      }
    } else if (!payload.equals(other.payload)) {
      return false;
    }
    return true;
  }

  @Override
  public String toString() {
    return "State [id=" + id + ", payload=" + payload + "]";
  }
}
