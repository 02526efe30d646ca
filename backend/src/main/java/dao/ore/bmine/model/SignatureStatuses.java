package dao.ore.bmine.model;

import java.util.List;
import java.util.Optional;

/**
 * Statuses in request order, observed at {@code slot}. Unknown signatures are empty.
 */
public record SignatureStatuses(List<Optional<SignatureStatus>> statuses, long slot) {}
