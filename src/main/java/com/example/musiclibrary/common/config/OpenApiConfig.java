package com.example.musiclibrary.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI musicLibraryOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Music Library API")
                        .description("本地音乐库同步、封面/歌手图片/歌词解析服务接口文档")
                        .version("v1")
                        .contact(new Contact().name("music-library")));
    }
}
