package com.tariffmonitor.monitor.discovery;

import com.tariffmonitor.monitor.model.CandidateLink;
import java.util.List;

/** Finds candidate document links on a source page, in page order. */
@FunctionalInterface
public interface CandidateResolver {
  List<CandidateLink> resolveCandidates(String sourcePageUrl) throws CandidateResolutionException;
}
