package com.libragraph.archive.core.db;

import com.libragraph.archive.core.dao.CopyFlagArgumentFactory;
import com.libragraph.archive.core.dao.CopyFlagColumnMapper;
import com.libragraph.archive.types.CopyFlag;
import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

@ApplicationScoped
public class JdbiProducer {

    @Produces
    @Singleton
    public Jdbi jdbi(AgroalDataSource dataSource) {
        return configure(Jdbi.create(dataSource).installPlugin(new PostgresPlugin()));
    }

    /**
     * SqlObject support, SQL logging and the archive's column types. Raw handle
     * queries see copy flags as {@link CopyFlag} too, not only the DAOs.
     */
    public static Jdbi configure(Jdbi jdbi) {
        return jdbi.installPlugin(new SqlObjectPlugin())
                .registerColumnMapper(CopyFlag.class, new CopyFlagColumnMapper())
                .registerArgument(new CopyFlagArgumentFactory())
                .setSqlLogger(new Slf4JSqlLogger());
    }
}
