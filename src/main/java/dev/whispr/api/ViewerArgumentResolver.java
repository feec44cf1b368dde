package dev.whispr.api;

import dev.whispr.user.MissingViewerException;
import java.util.UUID;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link Viewer} controller parameters from the {@value #VIEWER_HEADER} header, which the
 * gateway sets to the authenticated user's id.
 */
public class ViewerArgumentResolver implements HandlerMethodArgumentResolver {

  public static final String VIEWER_HEADER = "X-Whispr-Viewer";

  @Override
  public boolean supportsParameter(MethodParameter parameter) {
    return Viewer.class.equals(parameter.getParameterType());
  }

  @Override
  public Viewer resolveArgument(
      MethodParameter parameter,
      ModelAndViewContainer mavContainer,
      NativeWebRequest webRequest,
      WebDataBinderFactory binderFactory) {
    String header = webRequest.getHeader(VIEWER_HEADER);
    if (header == null || header.isBlank()) {
      throw new MissingViewerException("Missing " + VIEWER_HEADER + " header");
    }
    try {
      return new Viewer(UUID.fromString(header.trim()));
    } catch (IllegalArgumentException e) {
      throw new MissingViewerException("Invalid " + VIEWER_HEADER + " header: " + header, e);
    }
  }
}
