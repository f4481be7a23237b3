package com.geobot.paper.selection;

public enum StructureTag {
  /**
   * Market belongs to a recurring group (the record carries a group item title).
   */
  SERIES,
  NONE
}
