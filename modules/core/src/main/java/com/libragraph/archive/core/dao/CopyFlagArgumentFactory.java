package com.libragraph.archive.core.dao;

import com.libragraph.archive.types.CopyFlag;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class CopyFlagArgumentFactory extends AbstractArgumentFactory<CopyFlag> {

    public CopyFlagArgumentFactory() {
        super(Types.CHAR);
    }

    @Override
    protected Argument build(CopyFlag value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setString(position, value.code());
    }
}
