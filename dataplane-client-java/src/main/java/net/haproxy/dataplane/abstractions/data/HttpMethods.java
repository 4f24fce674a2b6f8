package net.haproxy.dataplane.abstractions.data;

import org.apache.http.client.methods.HttpDelete;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpPut;
import org.apache.http.client.methods.HttpRequestBase;

/**
 * Methods the Data Plane API is called with.
 */
public enum HttpMethods {
  GET {
    @Override
    public HttpRequestBase createRequest(String url) {
      return new HttpGet(url);
    }
  },
  /**
   * creates entities and transactions
   */
  POST {
    @Override
    public HttpRequestBase createRequest(String url) {
      return new HttpPost(url);
    }
  },
  /**
   * replaces entities, commits transactions
   */
  PUT {
    @Override
    public HttpRequestBase createRequest(String url) {
      return new HttpPut(url);
    }
  },
  /**
   * removes entities, rolls transactions back
   */
  DELETE {
    @Override
    public HttpRequestBase createRequest(String url) {
      return new HttpDelete(url);
    }
  };

  public abstract HttpRequestBase createRequest(String url);

  /**
   * @return true when requests of this method carry a JSON body
   */
  public boolean hasBody() {
    return this == POST || this == PUT;
  }
}
