// IFetcher.java
package com.urlsentry.core.api;

import com.urlsentry.core.model.FetchResult;
import java.net.URI;

/**
 * 페처 최소 계약: URL 하나를 받아 페치 결과를 돌려준다.
 * 네트워크 실패는 예외가 아니라 FetchResult.outcome으로 표현한다(잘못된 URL만 예외).
 */
public interface IFetcher extends AutoCloseable {
    FetchResult fetch(URI url);
    @Override default void close() {}
}
