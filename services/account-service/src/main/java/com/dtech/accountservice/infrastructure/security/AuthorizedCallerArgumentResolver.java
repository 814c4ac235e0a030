package com.dtech.accountservice.infrastructure.security;

import com.dtech.security.AuthorizedContext;
import com.dtech.security.Identity;
import com.dtech.security.SecurityMisconfigurationException;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Injects the caller established by {@link AuthorizationInterceptor} into handler parameters of type
 * {@link AuthorizedContext} or {@link Identity}.
 */
public class AuthorizedCallerArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        Class<?> type = parameter.getParameterType();
        return type == AuthorizedContext.class || type == Identity.class;
    }

    @Override
    public Object resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        Object context = webRequest.getAttribute(
                AuthorizationInterceptor.AUTHORIZED_CONTEXT, RequestAttributes.SCOPE_REQUEST);
        if (!(context instanceof AuthorizedContext)) {
            throw new SecurityMisconfigurationException(
                    "No authorized caller for " + parameter.getExecutable().getName());
        }
        AuthorizedContext authorized = (AuthorizedContext) context;
        return parameter.getParameterType() == Identity.class ? authorized.identity() : authorized;
    }
}
