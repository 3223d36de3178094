package com.frenchtoast.alert.r2dbc.store;

import java.time.Instant;
import java.time.OffsetDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.frenchtoast.alert.core.error.PersistenceException;
import com.frenchtoast.alert.core.model.Status;
import com.frenchtoast.alert.r2dbc.entity.StatusEntity;

import reactor.core.publisher.Mono;

/**
 * Database access helper for the single-row ft_status table.
 *
 * Every statement is keyed by {@link Status#SINGLETON_ID}; the row is never deleted.
 */
@Repository
public class StatusStore {

	private static final Logger log = LoggerFactory.getLogger(StatusStore.class);

	private final DatabaseClient db;

	public StatusStore(DatabaseClient db) {
		this.db = db;
	}

	/**
	 * Fresh read of the status row. Empty when the row has not been seeded yet.
	 */
	public Mono<Status> current() {
		String sql = "SELECT id, status, updated FROM ft_status WHERE id = :id";

		return db.sql(sql).bind("id", Status.SINGLETON_ID).map((row, meta) -> {
			StatusEntity e = new StatusEntity();
			e.setId(row.get("id", Integer.class));
			e.setStatus(row.get("status", String.class));
			e.setUpdated(row.get("updated", OffsetDateTime.class));
			return toModel(e);
		}).one().onErrorMap(DataAccessException.class, err -> failure("read status", err));
	}

	/**
	 * Returns the status row, seeding it with the sentinel value first when missing.
	 *
	 * Safe to race: a concurrent seeder losing on the primary key just re-reads.
	 */
	public Mono<Status> initialize() {
		return current().switchIfEmpty(Mono.defer(this::insertSentinel));
	}

	/**
	 * Commits a new status code in one conditional UPDATE.
	 *
	 * @return true when this call changed the row, false when the stored code already equals
	 *         {@code status} (a concurrent writer got there first)
	 */
	public Mono<Boolean> commitChange(String status, Instant updated) {
		String sql = "UPDATE ft_status SET status = :status, updated = :updated "
				+ "WHERE id = :id AND status <> :previous_not";

		return db.sql(sql).bind("status", status).bind("updated", Timestamps.toColumn(updated))
				.bind("id", Status.SINGLETON_ID).bind("previous_not", status).fetch().rowsUpdated()
				.map(rows -> rows > 0)
				.onErrorMap(DataAccessException.class, err -> failure("commit status " + status, err));
	}

	private Mono<Status> insertSentinel() {
		String sql = "INSERT INTO ft_status (id, status) VALUES (:id, :status)";

		return db.sql(sql).bind("id", Status.SINGLETON_ID).bind("status", Status.SENTINEL).fetch().rowsUpdated()
				.doOnNext(rows -> log.info("Seeded status row with sentinel value"))
				.onErrorResume(DataIntegrityViolationException.class, err -> {
					log.debug("Status row seeded concurrently: {}", err.getMessage());
					return Mono.just(0L);
				})
				.onErrorMap(DataAccessException.class, err -> failure("seed status", err))
				.then(current());
	}

	private static Status toModel(StatusEntity e) {
		String status = e.getStatus() == null ? Status.SENTINEL : e.getStatus();
		return new Status(e.getId(), status, Timestamps.fromColumn(e.getUpdated()));
	}

	private static PersistenceException failure(String op, Throwable cause) {
		return new PersistenceException("Failed to " + op + ": " + cause.getMessage(), cause);
	}
}
