// This file is part of PointZilla.
// Copyright (C) 2026  The PointZilla Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.pointzilla.append;

import com.google.common.base.Strings;

import net.pointzilla.exceptions.ConfigurationException;

/**
 * Whether appended batches replace the existing points they overlap.
 *
 * @since 1.0
 */
public enum CommandType {
  /** Adds points without deleting anything unless a time range is given. */
  APPEND,

  /** Replaces the existing points within each batch's range. */
  OVERWRITE;

  /**
   * @param name The case insensitive name.
   * @return The command.
   * @throws ConfigurationException if the name is unknown.
   */
  public static CommandType fromName(final String name) {
    if (!Strings.isNullOrEmpty(name)) {
      for (final CommandType command : values()) {
        if (command.name().equalsIgnoreCase(name.trim())) {
          return command;
        }
      }
    }
    throw new ConfigurationException("'" + name + "' is not a command. "
        + "Must be one of append or overwrite");
  }

  /**
   * @param name A possibly null word.
   * @return True if the word names a command.
   */
  public static boolean isCommand(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      return false;
    }
    for (final CommandType command : values()) {
      if (command.name().equalsIgnoreCase(name)) {
        return true;
      }
    }
    return false;
  }
}
