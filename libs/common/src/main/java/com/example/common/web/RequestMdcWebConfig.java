/*
 * どこで: Common Web 設定
 * 何を: RequestMdcInterceptor を全リクエストへ適用する
 * なぜ: auth/resource/gateway-bff のログへ同じ運用キーを埋め込むため
 */
package com.example.common.web;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class RequestMdcWebConfig implements WebMvcConfigurer {

  @Bean
  RequestMdcInterceptor requestMdcInterceptor() {
    return new RequestMdcInterceptor();
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor());
  }
}
