package dev.jobhunter.tool;

import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;

/**
 * Address the tool server is listening on. Set once the server binds, cleared on stop.
 */
@Component
public class ToolServerEndpoint {

    private volatile InetSocketAddress address;

    public void bind(InetSocketAddress address) {
        this.address = address;
    }

    public void unbind() {
        this.address = null;
    }

    /**
     * @return the bound address, or null while the server is not listening
     */
    public InetSocketAddress address() {
        return address;
    }

    public boolean isBound() {
        return address != null;
    }

    public int port() {
        InetSocketAddress current = address;
        return current != null ? current.getPort() : -1;
    }
}
