package com.flippercloud.flipper;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * The registered groups for one {@link Dsl}, shared with every {@link Feature} it creates.
 * <p>
 * Reads never lock: each registration replaces the whole map, so an evaluation in progress sees
 * either the old or the new set of groups.
 */
public final class GroupRegistry {
  private volatile ImmutableMap<String, GroupType> groups = ImmutableMap.of();
  private final Object writeLock = new Object();

  /**
   * Registers a group, replacing any previous registration with the same name.
   *
   * @param name the group name
   * @param callback the membership test
   * @return the registered group
   */
  public GroupType register(String name, GroupCallback callback) {
    GroupType group = new GroupType(name, callback);
    synchronized (writeLock) {
      ImmutableMap.Builder<String, GroupType> builder = ImmutableMap.builder();
      for (Map.Entry<String, GroupType> e: groups.entrySet()) {
        if (!e.getKey().equals(name)) {
          builder.put(e);
        }
      }
      builder.put(name, group);
      groups = builder.build();
    }
    return group;
  }

  /**
   * Looks up a registered group.
   *
   * @param name the group name
   * @return the group, or null if no group has that name
   */
  public GroupType get(String name) {
    return groups.get(name);
  }

  /**
   * Returns true if a group with this name is registered.
   *
   * @param name the group name
   * @return true if registered
   */
  public boolean contains(String name) {
    return groups.containsKey(name);
  }

  /**
   * Returns the names of all registered groups, in registration order.
   *
   * @return the group names
   */
  public Set<String> names() {
    return ImmutableSet.copyOf(groups.keySet());
  }

  /**
   * Returns all registered groups, in registration order.
   *
   * @return the groups
   */
  public Collection<GroupType> all() {
    return ImmutableList.copyOf(groups.values());
  }

  /**
   * Removes every registration.
   */
  public void clear() {
    synchronized (writeLock) {
      groups = ImmutableMap.of();
    }
  }
}
