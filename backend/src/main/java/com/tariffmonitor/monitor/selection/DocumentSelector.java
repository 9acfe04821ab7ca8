package com.tariffmonitor.monitor.selection;

import com.tariffmonitor.monitor.model.CandidateLink;
import com.tariffmonitor.monitor.model.DocumentSelection;
import java.util.List;

/**
 * Picks the candidate links that are the documents worth tracking for a source. The rationale
 * is stored for reporting only.
 */
@FunctionalInterface
public interface DocumentSelector {
  DocumentSelection select(String sourceName, List<CandidateLink> candidates)
      throws DocumentSelectionException;
}
