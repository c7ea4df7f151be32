package io.github.yok.dbanonymizer.db.h2;

import io.github.yok.dbanonymizer.config.ConnectionConfig;
import io.github.yok.dbanonymizer.db.AbstractDbDialectHandler;

/**
 * H2 dialect handler. ANSI quoting and pagination apply unchanged.
 *
 * @author Yasuharu.Okawauchi
 */
public class H2DialectHandler extends AbstractDbDialectHandler {

    @Override
    public String resolveSchema(ConnectionConfig.Entry entry) {
        return "PUBLIC";
    }
}
