package com.auctionvault.config;

import com.auctionvault.api.dto.response.ApiErrorResponse;
import com.auctionvault.api.dto.response.ApiResponse;
import com.auctionvault.auth.JwtAuthFilter;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps controller results in {@link ApiResponse} and stamps the acting identity on
 * both the envelope and the {@value #ACTOR_HEADER} response header.
 */
@RestControllerAdvice
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    public static final String ACTOR_HEADER = "X-Auction-Actor";

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return true;
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {

        String path = request.getURI().getPath();
        if (!path.startsWith("/api/")) {
            return body;
        }

        String actorId = actorOf(request);
        if (actorId != null) {
            response.getHeaders().set(ACTOR_HEADER, actorId);
        }

        if (body instanceof ApiResponse<?> || body instanceof ApiErrorResponse) {
            return body;
        }

        // StringHttpMessageConverter can't serialize ApiResponse
        if (StringHttpMessageConverter.class.isAssignableFrom(selectedConverterType)) {
            return body;
        }

        return ApiResponse.of(actorId, body);
    }

    private static String actorOf(ServerHttpRequest request) {
        if (!(request instanceof ServletServerHttpRequest)) {
            return null;
        }
        Object actor = ((ServletServerHttpRequest) request).getServletRequest().getAttribute(JwtAuthFilter.ACTOR_ATTRIBUTE);
        return actor instanceof String ? (String) actor : null;
    }
}
