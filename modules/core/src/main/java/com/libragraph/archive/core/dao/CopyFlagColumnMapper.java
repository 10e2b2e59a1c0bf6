package com.libragraph.archive.core.dao;

import com.libragraph.archive.types.CopyFlag;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class CopyFlagColumnMapper implements ColumnMapper<CopyFlag> {

    @Override
    public CopyFlag map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        String code = r.getString(columnNumber);
        return code == null ? null : CopyFlag.fromCode(code.trim());
    }
}
