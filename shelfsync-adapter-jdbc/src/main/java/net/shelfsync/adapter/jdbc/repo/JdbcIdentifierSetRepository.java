package net.shelfsync.adapter.jdbc.repo;

import net.shelfsync.adapter.jdbc.TxContext;
import net.shelfsync.core.spi.IdentifierSetRepository;

import java.sql.Connection;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

public final class JdbcIdentifierSetRepository implements IdentifierSetRepository {

    private Connection mustConn() {
        Connection c = TxContext.get();
        if (c == null) throw new IllegalStateException("TxContext required (wrap with JdbcTxRunner)");
        return c;
    }

    @Override
    public int add(String setKey, Collection<String> identifiers) throws Exception {
        if (identifiers.isEmpty()) return 0;
        int added = 0;
        try (var ps = mustConn().prepareStatement("""
            MERGE INTO TB_IDENTIFIER_SET t
            USING (SELECT ? AS set_key, ? AS identifier FROM dual) s
            ON (t.SET_KEY = s.set_key AND t.IDENTIFIER = s.identifier)
            WHEN NOT MATCHED THEN INSERT (SET_KEY, IDENTIFIER, CREATED_AT)
                VALUES (s.set_key, s.identifier, CURRENT_TIMESTAMP)
        """)) {
            for (String id : new LinkedHashSet<>(identifiers)) {
                ps.setString(1, setKey);
                ps.setString(2, id);
                added += ps.executeUpdate();
            }
        }
        return added;
    }

    @Override
    public Set<String> members(String setKey) throws Exception {
        try (var ps = mustConn().prepareStatement(
                "SELECT IDENTIFIER FROM TB_IDENTIFIER_SET WHERE SET_KEY=? ORDER BY IDENTIFIER")) {
            ps.setString(1, setKey);
            try (var rs = ps.executeQuery()) {
                var out = new LinkedHashSet<String>();
                while (rs.next()) out.add(rs.getString(1));
                return out;
            }
        }
    }

    @Override
    public int size(String setKey) throws Exception {
        try (var ps = mustConn().prepareStatement("SELECT COUNT(*) FROM TB_IDENTIFIER_SET WHERE SET_KEY=?")) {
            ps.setString(1, setKey);
            try (var rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    @Override
    public boolean delete(String setKey) throws Exception {
        try (var ps = mustConn().prepareStatement("DELETE FROM TB_IDENTIFIER_SET WHERE SET_KEY=?")) {
            ps.setString(1, setKey);
            return ps.executeUpdate() > 0;
        }
    }
}
