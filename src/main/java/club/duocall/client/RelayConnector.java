package club.duocall.client;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * 建立到信令服务器的连接。
 */
public interface RelayConnector {

    CompletableFuture<RelayChannel> connect(URI uri, RelayListener listener);
}
