package com.market.sentiment.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.sentiment.dto.CommonResponse;
import com.market.sentiment.util.PipelineRunStatusManager;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 运行状态过滤器 - 拦截查询接口，合并进行中时直接返回 423（资源被锁定），
 * 避免读到合并一半的派生表。注册方式见 FilterConfig。
 */
public class PipelineRunStatusFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunStatusFilter.class);

    static final int SC_LOCKED = 423;

    private final PipelineRunStatusManager statusManager;
    private final ObjectMapper objectMapper;

    public PipelineRunStatusFilter(PipelineRunStatusManager statusManager, ObjectMapper objectMapper) {
        this.statusManager = statusManager;
        this.objectMapper = objectMapper;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        if (statusManager.isRunInProgress()) {
            log.warn("拦截请求: {} {} (流水线正在运行)",
                    httpRequest.getMethod(), httpRequest.getRequestURI());

            httpResponse.setStatus(SC_LOCKED);
            httpResponse.setContentType(MediaType.APPLICATION_JSON_VALUE);
            httpResponse.setCharacterEncoding(StandardCharsets.UTF_8.name());

            CommonResponse<String> errorResponse = CommonResponse.error(
                    SC_LOCKED, "情感流水线正在合并数据，请稍后再试");
            httpResponse.getWriter().write(objectMapper.writeValueAsString(errorResponse));
            return;
        }

        chain.doFilter(request, response);
    }
}
