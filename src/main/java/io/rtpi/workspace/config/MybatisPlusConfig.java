package io.rtpi.workspace.config;

import com.baomidou.mybatisplus.core.handlers.MetaObjectHandler;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.ibatis.reflection.MetaObject;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.LocalDateTime;

@Configuration
public class MybatisPlusConfig {

    public MybatisPlusConfig(ObjectMapper objectMapper) {
        // metadata 列里有 LocalDateTime（sharedAt/createdAt），需要带 JavaTimeModule 的 Spring ObjectMapper
        JacksonTypeHandler.setObjectMapper(objectMapper);
    }

    /**
     * create_time / update_time 自动填充
     */
    @Bean
    public MetaObjectHandler metaObjectHandler(Clock clock) {
        return new MetaObjectHandler() {
            @Override
            public void insertFill(MetaObject metaObject) {
                LocalDateTime now = LocalDateTime.now(clock);
                strictInsertFill(metaObject, "createTime", LocalDateTime.class, now);
                strictInsertFill(metaObject, "updateTime", LocalDateTime.class, now);
            }

            @Override
            public void updateFill(MetaObject metaObject) {
                strictUpdateFill(metaObject, "updateTime", LocalDateTime.class, LocalDateTime.now(clock));
            }
        };
    }
}
