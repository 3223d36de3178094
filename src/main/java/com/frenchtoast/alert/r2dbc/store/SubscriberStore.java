package com.frenchtoast.alert.r2dbc.store;

import java.time.Instant;
import java.time.OffsetDateTime;

import org.springframework.dao.DataAccessException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.frenchtoast.alert.core.error.PersistenceException;
import com.frenchtoast.alert.core.model.Subscriber;
import com.frenchtoast.alert.r2dbc.entity.SubscriberEntity;

import io.r2dbc.spi.Readable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Database access helper for the ft_subscriber table.
 *
 * Each mutation is one statement on one row. Nothing here spans subscribers, so a fanout
 * interrupted half way leaves every row individually consistent.
 */
@Repository
public class SubscriberStore {

	private static final String COLUMNS = "id, team_id, channel_id, encrypted_url, added, last_notified, inactive";

	private final DatabaseClient db;

	public SubscriberStore(DatabaseClient db) {
		this.db = db;
	}

	public Mono<Subscriber> findById(long id) {
		String sql = "SELECT " + COLUMNS + " FROM ft_subscriber WHERE id = :id";

		return db.sql(sql).bind("id", id).map(SubscriberStore::read).one()
				.onErrorMap(DataAccessException.class, err -> failure("read subscriber " + id, err));
	}

	/**
	 * team/channel is the logical key but not a constraint; the oldest row wins.
	 */
	public Mono<Subscriber> findByTeamAndChannel(String teamId, String channelId) {
		String sql = "SELECT " + COLUMNS + " FROM ft_subscriber WHERE team_id = :team_id AND channel_id = :channel_id "
				+ "ORDER BY id ASC LIMIT 1";

		return db.sql(sql).bind("team_id", teamId).bind("channel_id", channelId).map(SubscriberStore::read).one()
				.onErrorMap(DataAccessException.class, err -> failure("read subscriber " + teamId + "/" + channelId, err));
	}

	/**
	 * Active subscribers still owed the status generation {@code statusTimestamp}, or every
	 * active subscriber when {@code force} is set.
	 */
	public Flux<Subscriber> findDeliverable(Instant statusTimestamp, boolean force) {
		if (force || statusTimestamp == null) {
			String sql = "SELECT " + COLUMNS + " FROM ft_subscriber WHERE inactive = FALSE ORDER BY id ASC";
			return db.sql(sql).map(SubscriberStore::read).all()
					.onErrorMap(DataAccessException.class, err -> failure("select active subscribers", err));
		}

		String sql = "SELECT " + COLUMNS + " FROM ft_subscriber WHERE inactive = FALSE "
				+ "AND (last_notified IS NULL OR last_notified <> :ts) ORDER BY id ASC";

		return db.sql(sql).bind("ts", Timestamps.toColumn(statusTimestamp)).map(SubscriberStore::read).all()
				.onErrorMap(DataAccessException.class, err -> failure("select deliverable subscribers", err));
	}

	public Mono<Long> countActive() {
		return db.sql("SELECT COUNT(*) AS n FROM ft_subscriber WHERE inactive = FALSE")
				.map((row, meta) -> ((Number) row.get("n")).longValue()).one()
				.onErrorMap(DataAccessException.class, err -> failure("count subscribers", err));
	}

	/**
	 * @return the generated subscriber id
	 */
	public Mono<Long> insert(String teamId, String channelId, String encryptedUrl, Instant added) {
		String sql = "INSERT INTO ft_subscriber (team_id, channel_id, encrypted_url, added, inactive) "
				+ "VALUES (:team_id, :channel_id, :encrypted_url, :added, FALSE)";

		return db.sql(sql).bind("team_id", teamId).bind("channel_id", channelId).bind("encrypted_url", encryptedUrl)
				.bind("added", Timestamps.toColumn(added))
				.filter((statement, next) -> next.execute(statement.returnGeneratedValues("id")))
				.map((row, meta) -> ((Number) row.get(0)).longValue()).one()
				.onErrorMap(DataAccessException.class, err -> failure("insert subscriber " + teamId + "/" + channelId, err));
	}

	/**
	 * Re-registration: replaces the delivery url and flips the subscriber back to active.
	 */
	public Mono<Void> reactivate(long id, String encryptedUrl) {
		String sql = "UPDATE ft_subscriber SET encrypted_url = :encrypted_url, inactive = FALSE WHERE id = :id";
		return db.sql(sql).bind("encrypted_url", encryptedUrl).bind("id", id).fetch().rowsUpdated().then()
				.onErrorMap(DataAccessException.class, err -> failure("reactivate subscriber " + id, err));
	}

	/**
	 * Only moves {@code last_notified} forward; a slow delivery of an older status generation
	 * finishing after a newer one leaves the newer timestamp in place.
	 */
	public Mono<Void> markNotified(long id, Instant statusTimestamp) {
		String sql = "UPDATE ft_subscriber SET last_notified = :last_notified WHERE id = :id "
				+ "AND (last_notified IS NULL OR last_notified < :not_after)";
		OffsetDateTime ts = Timestamps.toColumn(statusTimestamp);
		return db.sql(sql).bind("last_notified", ts).bind("id", id).bind("not_after", ts).fetch()
				.rowsUpdated().then()
				.onErrorMap(DataAccessException.class, err -> failure("mark subscriber " + id + " notified", err));
	}

	public Mono<Void> markInactive(long id) {
		String sql = "UPDATE ft_subscriber SET inactive = TRUE WHERE id = :id";
		return db.sql(sql).bind("id", id).fetch().rowsUpdated().then()
				.onErrorMap(DataAccessException.class, err -> failure("mark subscriber " + id + " inactive", err));
	}

	private static Subscriber read(Readable row) {
		SubscriberEntity e = new SubscriberEntity();
		e.setId(((Number) row.get("id")).longValue());
		e.setTeamId(row.get("team_id", String.class));
		e.setChannelId(row.get("channel_id", String.class));
		e.setEncryptedUrl(row.get("encrypted_url", String.class));
		e.setAdded(row.get("added", OffsetDateTime.class));
		e.setLastNotified(row.get("last_notified", OffsetDateTime.class));
		e.setInactive(row.get("inactive", Boolean.class));
		return toModel(e);
	}

	private static Subscriber toModel(SubscriberEntity e) {
		return new Subscriber(e.getId(), e.getTeamId(), e.getChannelId(), e.getEncryptedUrl(),
				Timestamps.fromColumn(e.getAdded()), Timestamps.fromColumn(e.getLastNotified()),
				Boolean.TRUE.equals(e.getInactive()));
	}

	private static PersistenceException failure(String op, Throwable cause) {
		return new PersistenceException("Failed to " + op + ": " + cause.getMessage(), cause);
	}
}
