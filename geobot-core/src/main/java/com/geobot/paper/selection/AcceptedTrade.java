package com.geobot.paper.selection;

import java.math.BigDecimal;

public record AcceptedTrade(Candidate candidate, BigDecimal stake) {
}
