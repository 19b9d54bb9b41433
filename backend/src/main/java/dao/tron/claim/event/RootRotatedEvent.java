package dao.tron.claim.event;

import dao.tron.claim.model.RootEpoch;

public record RootRotatedEvent(RootEpoch previous, RootEpoch current) {}
