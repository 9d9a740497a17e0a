/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.warehouse.hook;

import org.apache.calcite.adapter.warehouse.scd.VersionedRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of resolving hooks for a batch of versioned records.
 *
 * <p>Records whose hooks could not be composed are quarantined rather than
 * failing the batch; they cannot take part in any relationship until the
 * source data is corrected.
 */
public class HookResolution {

  private final List<HookedRecord> records;
  private final List<Quarantined> quarantined;

  HookResolution(List<HookedRecord> records, List<Quarantined> quarantined) {
    this.records = Collections.unmodifiableList(new ArrayList<HookedRecord>(records));
    this.quarantined = Collections.unmodifiableList(new ArrayList<Quarantined>(quarantined));
  }

  /** Returns the records whose hooks were composed. */
  public List<HookedRecord> getRecords() {
    return records;
  }

  /** Returns the excluded records with the reason for each. */
  public List<Quarantined> getQuarantined() {
    return quarantined;
  }

  public int getQuarantineCount() {
    return quarantined.size();
  }

  /**
   * A record excluded from hook composition.
   */
  public static class Quarantined {
    /** Why a record was quarantined. */
    public enum Reason {
      /** A hook component column is null, blank or absent. */
      MISSING_HOOK_COMPONENT,
      /** A hook component value violates the hook grammar. */
      MALFORMED_HOOK
    }

    private final VersionedRecord record;
    private final String hook;
    private final Reason reason;
    private final String message;

    Quarantined(VersionedRecord record, String hook, Reason reason, String message) {
      this.record = record;
      this.hook = hook;
      this.reason = reason;
      this.message = message;
    }

    public VersionedRecord getRecord() {
      return record;
    }

    /** Returns the name of the hook that could not be composed. */
    public String getHook() {
      return hook;
    }

    public Reason getReason() {
      return reason;
    }

    public String getMessage() {
      return message;
    }

    @Override public String toString() {
      return "Quarantined{key='" + record.getUniqueKey() + "', hook='" + hook + "', "
          + reason + ": " + message + "}";
    }
  }
}
