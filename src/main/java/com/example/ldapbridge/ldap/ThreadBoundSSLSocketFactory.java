package com.example.ldapbridge.ldap;

import javax.net.SocketFactory;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.net.InetAddress;
import java.net.Socket;
import java.net.UnknownHostException;

/**
 * JNDI only accepts a socket factory class name for ldaps:// URLs and calls its
 * static {@code getDefault()}. This class hands out whatever factory the current
 * thread bound for the connection it is opening; connections are opened
 * synchronously on the calling thread and are never pooled.
 */
public class ThreadBoundSSLSocketFactory extends SSLSocketFactory {

    private static final ThreadLocal<SSLSocketFactory> CURRENT = new ThreadLocal<>();

    private final SSLSocketFactory sslFactory;

    private ThreadBoundSSLSocketFactory(SSLSocketFactory sslFactory) {
        this.sslFactory = sslFactory;
    }

    public static SocketFactory getDefault() {
        SSLSocketFactory bound = CURRENT.get();
        return new ThreadBoundSSLSocketFactory(bound != null ? bound : (SSLSocketFactory) SSLSocketFactory.getDefault());
    }

    static void bind(SSLSocketFactory factory) {
        CURRENT.set(factory);
    }

    static void unbind() {
        CURRENT.remove();
    }

    @Override
    public Socket createSocket(Socket s, String host, int port, boolean autoClose) throws IOException {
        return sslFactory.createSocket(s, host, port, autoClose);
    }

    @Override
    public String[] getDefaultCipherSuites() {
        return sslFactory.getDefaultCipherSuites();
    }

    @Override
    public String[] getSupportedCipherSuites() {
        return sslFactory.getSupportedCipherSuites();
    }

    @Override
    public Socket createSocket() throws IOException {
        return sslFactory.createSocket();
    }

    @Override
    public Socket createSocket(String host, int port) throws IOException, UnknownHostException {
        return sslFactory.createSocket(host, port);
    }

    @Override
    public Socket createSocket(InetAddress host, int port) throws IOException {
        return sslFactory.createSocket(host, port);
    }

    @Override
    public Socket createSocket(String host, int port, InetAddress localHost, int localPort)
            throws IOException, UnknownHostException {
        return sslFactory.createSocket(host, port, localHost, localPort);
    }

    @Override
    public Socket createSocket(InetAddress address, int port, InetAddress localAddress, int localPort)
            throws IOException {
        return sslFactory.createSocket(address, port, localAddress, localPort);
    }
}
