package com.geobot.paper.selection;

import java.util.Optional;

public record EnrichmentResult(Candidate candidate, RejectReason rejectReason) {

  public static EnrichmentResult accepted(Candidate candidate) {
    return new EnrichmentResult(candidate, null);
  }

  public static EnrichmentResult rejected(RejectReason reason) {
    return new EnrichmentResult(null, reason);
  }

  public boolean isAccepted() {
    return candidate != null;
  }

  public Optional<Candidate> asOptional() {
    return Optional.ofNullable(candidate);
  }
}
