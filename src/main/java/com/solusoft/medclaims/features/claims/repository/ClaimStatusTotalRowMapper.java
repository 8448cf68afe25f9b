package com.solusoft.medclaims.features.claims.repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;

import org.springframework.jdbc.core.RowMapper;

import com.solusoft.medclaims.features.claims.model.ClaimStatus;
import com.solusoft.medclaims.features.claims.model.ClaimStatusTotal;

public class ClaimStatusTotalRowMapper implements RowMapper<ClaimStatusTotal> {

    @Override
    public ClaimStatusTotal mapRow(ResultSet rs, int rowNum) throws SQLException {
        BigDecimal approved = rs.getBigDecimal("approved_total");
        return new ClaimStatusTotal(ClaimStatus.valueOf(rs.getString("status")), rs.getLong("claim_count"),
                approved == null ? BigDecimal.ZERO : approved);
    }
}
