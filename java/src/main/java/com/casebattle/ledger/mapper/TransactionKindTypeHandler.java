package com.casebattle.ledger.mapper;

import com.casebattle.ledger.domain.TransactionKind;
import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;
import org.apache.ibatis.type.MappedTypes;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Stores {@link TransactionKind} as its lower-case code ("deposit" / "withdraw").
 */
@MappedTypes(TransactionKind.class)
public class TransactionKindTypeHandler extends BaseTypeHandler<TransactionKind> {

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, TransactionKind parameter, JdbcType jdbcType)
            throws SQLException {
        ps.setString(i, parameter.getCode());
    }

    @Override
    public TransactionKind getNullableResult(ResultSet rs, String columnName) throws SQLException {
        return toKind(rs.getString(columnName));
    }

    @Override
    public TransactionKind getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        return toKind(rs.getString(columnIndex));
    }

    @Override
    public TransactionKind getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        return toKind(cs.getString(columnIndex));
    }

    private static TransactionKind toKind(String code) {
        return code == null ? null : TransactionKind.fromCode(code);
    }
}
