package com.solusoft.medclaims.config;

import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;

import org.postgresql.util.PGobject;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.jdbc.repository.config.AbstractJdbcConfiguration;
import org.springframework.data.relational.core.dialect.Dialect;
import org.springframework.data.relational.core.dialect.PostgresDialect;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;

import com.solusoft.medclaims.features.audit.model.AuditDetails;

@Configuration
public class ClaimsJdbcConfig extends AbstractJdbcConfiguration {

    @Override
    public Dialect jdbcDialect(NamedParameterJdbcOperations operations) {
        return PostgresDialect.INSTANCE;
    }

    @Override
    protected List<?> userConverters() {
        return Arrays.asList(new AuditDetailsToJsonbConverter(), new JsonbToAuditDetailsConverter());
    }

    /**
     * Audit details are stored in a JSONB column; the driver needs the value typed explicitly.
     */
    @WritingConverter
    static class AuditDetailsToJsonbConverter implements Converter<AuditDetails, PGobject> {
        @Override
        public PGobject convert(AuditDetails source) {
            PGobject jsonObject = new PGobject();
            jsonObject.setType("jsonb");
            try {
                jsonObject.setValue(source.json());
            } catch (SQLException e) {
                throw new IllegalArgumentException("Failed to convert audit details to JSONB", e);
            }
            return jsonObject;
        }
    }

    @ReadingConverter
    static class JsonbToAuditDetailsConverter implements Converter<PGobject, AuditDetails> {
        @Override
        public AuditDetails convert(PGobject source) {
            return new AuditDetails(source.getValue());
        }
    }
}
