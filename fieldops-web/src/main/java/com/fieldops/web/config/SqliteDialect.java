package com.fieldops.web.config;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.relational.core.dialect.AbstractDialect;
import org.springframework.data.relational.core.dialect.LimitClause;
import org.springframework.data.relational.core.dialect.LockClause;
import org.springframework.data.relational.core.sql.LockOptions;

import java.util.Collection;
import java.util.List;

/**
 * SQLite 方言：Spring Data JDBC 内置不支持 SQLite，手动提供。
 * 声明 LIMIT/OFFSET 风格，并把 BOOLEAN 列读出的 0/1 转成 Boolean。
 */
public class SqliteDialect extends AbstractDialect {

    public static final SqliteDialect INSTANCE = new SqliteDialect();

    @Override
    public LimitClause limit() {
        return new LimitClause() {
            @Override
            public String getLimit(long limit) {
                return "LIMIT " + limit;
            }

            @Override
            public String getOffset(long offset) {
                // SQLite 不允许单独的 OFFSET
                return "LIMIT -1 OFFSET " + offset;
            }

            @Override
            public String getLimitOffset(long limit, long offset) {
                return "LIMIT " + limit + " OFFSET " + offset;
            }

            @Override
            public Position getClausePosition() {
                return Position.AFTER_ORDER_BY;
            }
        };
    }

    @Override
    public LockClause lock() {
        // SQLite 不支持 SELECT ... FOR UPDATE，返回空实现
        return new LockClause() {
            @Override
            public String getLock(LockOptions lockOptions) {
                return "";
            }

            @Override
            public Position getClausePosition() {
                return Position.AFTER_ORDER_BY;
            }
        };
    }

    @Override
    public Collection<Object> getConverters() {
        return List.of(IntegerToBooleanConverter.INSTANCE);
    }

    @ReadingConverter
    enum IntegerToBooleanConverter implements Converter<Integer, Boolean> {
        INSTANCE;

        @Override
        public Boolean convert(Integer source) {
            return source != 0;
        }
    }
}
