package com.market.sentiment.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.sentiment.filter.PipelineRunStatusFilter;
import com.market.sentiment.util.PipelineRunStatusManager;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FilterConfig {

    @Bean
    public FilterRegistrationBean<PipelineRunStatusFilter> pipelineRunStatusFilterBean(
            PipelineRunStatusManager statusManager, ObjectMapper objectMapper) {
        FilterRegistrationBean<PipelineRunStatusFilter> registrationBean =
                new FilterRegistrationBean<>(new PipelineRunStatusFilter(statusManager, objectMapper));

        // 只拦截查询接口，运行触发接口自行处理并发
        registrationBean.addUrlPatterns("/api/v1/brands/*", "/api/v1/anomalies", "/api/v1/topics/*");
        registrationBean.setOrder(1);

        return registrationBean;
    }
}
