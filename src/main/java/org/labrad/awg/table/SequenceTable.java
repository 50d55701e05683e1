package org.labrad.awg.table;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * The sequence table, with 1-based line numbers.
 */
public class SequenceTable {
  private final List<TableEntry> entries = Lists.newArrayList();

  /**
   * Append an entry and return its line number.
   */
  public int add(TableEntry entry) {
    entries.add(Preconditions.checkNotNull(entry));
    return entries.size();
  }

  public TableEntry getLine(int line) {
    Preconditions.checkArgument(line >= 1 && line <= entries.size(), "No table line %s", line);
    return entries.get(line - 1);
  }

  public List<TableEntry> getEntries() {
    return Lists.newArrayList(entries);
  }

  public int size() {
    return entries.size();
  }
}
