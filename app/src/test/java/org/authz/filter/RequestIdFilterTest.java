package org.authz.filter;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.core.MultivaluedHashMap;
import jakarta.ws.rs.core.MultivaluedMap;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RequestIdFilterTest {
  private RequestIdFilter requestIdFilter;
  private ContainerRequestContext mockRequest;

  @BeforeEach
  void setUp() {
    requestIdFilter = new RequestIdFilter();
    mockRequest = mock(ContainerRequestContext.class);
  }

  @Test
  void filter_RequestIdHeader_IsKept() {
    when(mockRequest.getHeaderString(RequestIdFilter.REQUEST_ID_HEADER)).thenReturn("test");

    requestIdFilter.filter(mockRequest);

    verify(mockRequest).setProperty(RequestIdFilter.REQUEST_ID_PROPERTY, "test");
    assertThat(MDC.get(RequestIdFilter.REQUEST_ID_PROPERTY), is("test"));
  }

  @Test
  void filter_NoRequestIdHeader_GeneratesOne() {
    requestIdFilter.filter(mockRequest);

    assertGeneratedRequestId();
  }

  @Test
  void filter_OversizedRequestIdHeader_GeneratesOne() {
    when(mockRequest.getHeaderString(RequestIdFilter.REQUEST_ID_HEADER))
        .thenReturn("x".repeat(RequestIdFilter.MAX_REQUEST_ID_LENGTH + 1));

    requestIdFilter.filter(mockRequest);

    assertGeneratedRequestId();
  }

  @Test
  void filter_Response_EchoesRequestIdAndClearsMdc() {
    MDC.put(RequestIdFilter.REQUEST_ID_PROPERTY, "test");
    when(mockRequest.getProperty(RequestIdFilter.REQUEST_ID_PROPERTY)).thenReturn("test");
    ContainerResponseContext mockResponse = mock(ContainerResponseContext.class);
    MultivaluedMap<String, Object> headers = new MultivaluedHashMap<>();
    when(mockResponse.getHeaders()).thenReturn(headers);

    requestIdFilter.filter(mockRequest, mockResponse);

    assertThat(headers.getFirst(RequestIdFilter.REQUEST_ID_HEADER), is("test"));
    assertThat(MDC.get(RequestIdFilter.REQUEST_ID_PROPERTY), is(nullValue()));
  }

  @Test
  void getRequestId_NoProperty_ReturnsEmpty() {
    assertThat(RequestIdFilter.getRequestId(mockRequest), is(""));
  }

  private void assertGeneratedRequestId() {
    ArgumentCaptor<Object> requestId = ArgumentCaptor.forClass(Object.class);
    verify(mockRequest).setProperty(eq(RequestIdFilter.REQUEST_ID_PROPERTY), requestId.capture());
    assertThat(requestId.getValue(), is(not(nullValue())));
    UUID.fromString((String) requestId.getValue());
  }
}
