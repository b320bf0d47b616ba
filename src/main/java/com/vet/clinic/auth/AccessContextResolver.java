package com.vet.clinic.auth;

import com.vet.clinic.exception.AccessDeniedException;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Builds the {@link AccessContext} for controller methods from the identity headers
 * set by the authenticating gateway in front of this service.
 */
@Component
public class AccessContextResolver implements HandlerMethodArgumentResolver {

    public static final String IDENTITY_HEADER = "X-User-Identity";
    public static final String ROLE_HEADER = "X-User-Role";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return AccessContext.class.equals(parameter.getParameterType());
    }

    @Override
    public AccessContext resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                         NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        String identity = webRequest.getHeader(IDENTITY_HEADER);
        String rawRole = webRequest.getHeader(ROLE_HEADER);
        Role role = Role.parse(rawRole)
                .orElseThrow(() -> new AccessDeniedException("Missing or unknown role header: " + rawRole));
        try {
            return new AccessContext(identity, role);
        } catch (IllegalArgumentException e) {
            throw new AccessDeniedException("Missing identity header.", e);
        }
    }
}
