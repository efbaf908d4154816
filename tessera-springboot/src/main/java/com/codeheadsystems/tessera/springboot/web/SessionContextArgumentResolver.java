package com.codeheadsystems.tessera.springboot.web;

import com.codeheadsystems.tessera.middleware.SessionContext;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Lets controller methods declare a {@link SessionContext} parameter.
 */
public class SessionContextArgumentResolver implements HandlerMethodArgumentResolver {

  @Override
  public boolean supportsParameter(MethodParameter parameter) {
    return SessionContext.class.equals(parameter.getParameterType());
  }

  @Override
  public Object resolveArgument(MethodParameter parameter,
                                ModelAndViewContainer mavContainer,
                                NativeWebRequest webRequest,
                                WebDataBinderFactory binderFactory) {
    Object context = webRequest.getAttribute(SessionContext.ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
    if (context == null) {
      throw new IllegalStateException("No session context on request; is the SessionFilter registered?");
    }
    return context;
  }
}
