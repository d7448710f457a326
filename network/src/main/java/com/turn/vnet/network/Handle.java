package com.turn.vnet.network;

/**
 * Opaque, generation-checked key for an entry of a {@link HandleArena}.
 *
 * <p>
 * Handles never expose the object they refer to. Once the entry is removed
 * from its arena the slot may be reused, but the reused slot carries a new
 * generation, so a stale handle keeps resolving to nothing instead of to the
 * new occupant. Handles issued by one arena never resolve in another.
 * </p>
 */
public final class Handle {

  private final int myArenaId;
  private final int myIndex;
  private final int myGeneration;

  Handle(int arenaId, int index, int generation) {
    myArenaId = arenaId;
    myIndex = index;
    myGeneration = generation;
  }

  int getArenaId() {
    return myArenaId;
  }

  int getIndex() {
    return myIndex;
  }

  int getGeneration() {
    return myGeneration;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    Handle handle = (Handle) o;

    if (myArenaId != handle.myArenaId) return false;
    if (myIndex != handle.myIndex) return false;
    return myGeneration == handle.myGeneration;
  }

  @Override
  public int hashCode() {
    int result = myArenaId;
    result = 31 * result + myIndex;
    result = 31 * result + myGeneration;
    return result;
  }

  @Override
  public String toString() {
    return "#" + myArenaId + ":" + myIndex + "." + myGeneration;
  }
}
