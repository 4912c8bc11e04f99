package com.tollgate.quota.store;

import com.tollgate.jdbc.ConnectionProvider;
import com.tollgate.quota.QuotaStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link QuotaStore} over the {@code projects} table. The charge is a single conditional
 * {@code UPDATE ... RETURNING}: month rollover, the limit check and both counters are applied in one
 * statement, so row-level locking alone keeps concurrent charges under the limit.
 */
public final class JdbcQuotaStore implements QuotaStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcQuotaStore.class);

    private static final String TABLE = "projects";

    static final String SQL_CHARGE = "UPDATE " + TABLE + " SET monthly_quota_month = ?, " +
            "monthly_quota_used = (CASE WHEN monthly_quota_month = ? THEN monthly_quota_used ELSE 0 END) + ?, " +
            "total_quota_used = total_quota_used + ? " +
            "WHERE id = ? AND (CASE WHEN monthly_quota_month = ? THEN monthly_quota_used ELSE 0 END) + ? <= monthly_quota_limit " +
            "RETURNING monthly_quota_used, monthly_quota_limit";
    static final String SQL_CHARGE_DEFERRED = "UPDATE " + TABLE + " SET monthly_quota_month = ?, " +
            "monthly_quota_used = LEAST(monthly_quota_limit, (CASE WHEN monthly_quota_month = ? THEN monthly_quota_used ELSE 0 END) + ?), " +
            "total_quota_used = total_quota_used + ? " +
            "WHERE id = ?";
    static final String SQL_FETCH = "SELECT monthly_quota_limit, monthly_quota_used, monthly_quota_month, total_quota_used FROM " +
            TABLE + " WHERE id = ?";
    static final String SQL_PROVISION = "INSERT INTO " + TABLE +
            " (id, monthly_quota_month, monthly_quota_used, monthly_quota_limit, total_quota_used) VALUES (?,?,0,?,0) " +
            "ON CONFLICT (id) DO NOTHING";
    static final String SQL_UPDATE_LIMIT = "UPDATE " + TABLE + " SET monthly_quota_limit = ? WHERE id = ?";

    private final ConnectionProvider connectionProvider;

    public JdbcQuotaStore(ConnectionProvider connectionProvider) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    }

    @Override
    public Optional<ProjectQuota> fetch(UUID projectId) {
        try (Connection c = connectionProvider.getConnection();
             PreparedStatement ps = c.prepareStatement(SQL_FETCH)) {
            ps.setObject(1, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new ProjectQuota(projectId, rs.getLong(1), rs.getLong(2),
                        rs.getObject(3, LocalDate.class), rs.getLong(4)));
            }
        } catch (SQLException e) {
            throw new QuotaStoreException("Failed to read quota for project " + projectId, e);
        }
    }

    @Override
    public Optional<QuotaCharge> tryCharge(UUID projectId, long units, LocalDate monthStart) {
        try (Connection c = connectionProvider.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(SQL_CHARGE)) {
                ps.setObject(1, monthStart);
                ps.setObject(2, monthStart);
                ps.setLong(3, units);
                ps.setLong(4, units);
                ps.setObject(5, projectId);
                ps.setObject(6, monthStart);
                ps.setLong(7, units);
                Optional<QuotaCharge> charge;
                try (ResultSet rs = ps.executeQuery()) {
                    charge = rs.next() ? Optional.of(new QuotaCharge(rs.getLong(1), rs.getLong(2))) : Optional.empty();
                }
                if (charge.isPresent()) {
                    c.commit();
                    log.debug("Quota charged | project={} units={} used={} limit={}", projectId, units,
                            charge.get().used(), charge.get().limit());
                } else {
                    c.rollback();
                }
                return charge;
            } catch (SQLException e) {
                rollbackQuietly(c, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new QuotaStoreException("Failed to charge " + units + " unit(s) to project " + projectId, e);
        }
    }

    @Override
    public boolean chargeDeferred(UUID projectId, long units, LocalDate monthStart) {
        try (Connection c = connectionProvider.getConnection();
             PreparedStatement ps = c.prepareStatement(SQL_CHARGE_DEFERRED)) {
            ps.setObject(1, monthStart);
            ps.setObject(2, monthStart);
            ps.setLong(3, units);
            ps.setLong(4, units);
            ps.setObject(5, projectId);
            boolean applied = ps.executeUpdate() == 1;
            log.debug("Deferred quota billed | project={} units={} applied={}", projectId, units, applied);
            return applied;
        } catch (SQLException e) {
            throw new QuotaStoreException("Failed to bill " + units + " deferred unit(s) to project " + projectId, e);
        }
    }

    @Override
    public boolean provision(UUID projectId, long limit, LocalDate monthStart) {
        try (Connection c = connectionProvider.getConnection();
             PreparedStatement ps = c.prepareStatement(SQL_PROVISION)) {
            ps.setObject(1, projectId);
            ps.setObject(2, monthStart);
            ps.setLong(3, limit);
            boolean inserted = ps.executeUpdate() == 1;
            log.info("Quota row {} | {} | project={} limit={}", inserted ? "created" : "already present", TABLE, projectId, limit);
            return inserted;
        } catch (SQLException e) {
            throw new QuotaStoreException("Failed to provision quota for project " + projectId, e);
        }
    }

    @Override
    public boolean updateLimit(UUID projectId, long limit) {
        try (Connection c = connectionProvider.getConnection();
             PreparedStatement ps = c.prepareStatement(SQL_UPDATE_LIMIT)) {
            ps.setLong(1, limit);
            ps.setObject(2, projectId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new QuotaStoreException("Failed to update quota limit for project " + projectId, e);
        }
    }

    private static void rollbackQuietly(Connection c, SQLException cause) {
        try {
            c.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    @Override
    public String toString() {
        return "JdbcQuotaStore{" + connectionProvider + "}";
    }
}
