package com.questrail.modbus.transport.tcp.netty;

import com.questrail.modbus.transport.ModbusStream;
import com.questrail.modbus.transport.ModbusTransportException;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpModbusStream
 * =============================================================================
 * Netty-backed implementation of the {@link ModbusStream} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It turns Netty's
 * event-driven TCP channel into the blocking, timeout-bounded stream the Modbus
 * client expects.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Interpret Modbus frames</li>
 *   <li>Retry reads, writes or connects</li>
 *   <li>Reconnect after the peer closes</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <p>Inbound bytes are copied into {@code byte[]} chunks on the event loop and
 * handed to the reading thread through a blocking queue. All reference-counted
 * buffers are released internally.</p>
 *
 * <h2>Lifecycle</h2>
 * Each stream owns a dedicated single-threaded {@link NioEventLoopGroup}.
 * {@link #close()} closes the channel and shuts the group down.
 */
public final class NettyTcpModbusStream implements ModbusStream
{
    /** Queue marker for end of stream; compared by identity. */
    private static final byte[] END_OF_STREAM = new byte[0];

    private final EventLoopGroup group;
    private final Channel channel;
    private final InboundHandler handler;
    private final Duration readTimeout;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // Reading-thread state only.
    private byte[] pending;
    private int pendingOffset;

    private NettyTcpModbusStream(EventLoopGroup group,
                                 Channel channel,
                                 InboundHandler handler,
                                 Duration readTimeout)
    {
        this.group = group;
        this.channel = channel;
        this.handler = handler;
        this.readTimeout = readTimeout;
    }

    /**
     * Connect to {@code host:port} and return a ready stream.
     *
     * @throws ModbusTransportException if the connection is refused, cannot be
     *         resolved, or does not complete within {@code connectTimeout}
     */
    public static NettyTcpModbusStream open(String host,
                                            int port,
                                            Duration connectTimeout,
                                            Duration readTimeout) throws ModbusTransportException
    {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(readTimeout, "readTimeout");

        final EventLoopGroup group = new NioEventLoopGroup(1);
        final InboundHandler handler = new InboundHandler();

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.toIntExact(connectTimeout.toMillis()))
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<NioSocketChannel>() {
                    @Override
                    protected void initChannel(NioSocketChannel ch)
                    {
                        ch.pipeline().addLast(handler);
                    }
                });

        ChannelFuture f = bootstrap.connect(host, port).awaitUninterruptibly();
        if (!f.isSuccess()) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            throw new ModbusTransportException(
                    "Could not connect to " + host + ":" + port, f.cause());
        }

        return new NettyTcpModbusStream(group, f.channel(), handler, readTimeout);
    }

    @Override
    public void write(byte[] data) throws ModbusTransportException
    {
        Objects.requireNonNull(data, "data");
        ensureOpen();

        // Copy: the caller may reuse its array once this method returns.
        ChannelFuture f = channel.writeAndFlush(Unpooled.copiedBuffer(data));
        if (!f.awaitUninterruptibly(readTimeout.toMillis())) {
            throw new ModbusTransportException(
                    "Write timed out after " + readTimeout.toMillis() + " ms");
        }
        if (!f.isSuccess()) {
            throw new ModbusTransportException("Write failed", f.cause());
        }
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws ModbusTransportException
    {
        Objects.checkFromIndexSize(offset, length, buffer.length);
        if (length == 0) {
            return 0;
        }
        if (pending == null || pendingOffset == pending.length) {
            pending = nextChunk();
            pendingOffset = 0;
        }

        int n = Math.min(length, pending.length - pendingOffset);
        System.arraycopy(pending, pendingOffset, buffer, offset, n);
        pendingOffset += n;
        return n;
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        channel.close().awaitUninterruptibly();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    private byte[] nextChunk() throws ModbusTransportException
    {
        ensureOpen();

        final byte[] chunk;
        try {
            chunk = handler.inbound.poll(readTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModbusTransportException("Interrupted while waiting for response", e);
        }

        if (chunk == null) {
            throw new ModbusTransportException(
                    "Read timed out after " + readTimeout.toMillis() + " ms");
        }
        if (chunk == END_OF_STREAM) {
            // Leave the marker for any later read.
            handler.inbound.offer(END_OF_STREAM);
            Throwable cause = handler.failure;
            if (cause != null) {
                throw new ModbusTransportException("Connection failed", cause);
            }
            throw new ModbusTransportException("Connection closed by peer");
        }
        return chunk;
    }

    private void ensureOpen() throws ModbusTransportException
    {
        if (closed.get()) {
            throw new ModbusTransportException("Stream is closed");
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies received bytes out of Netty buffers and queues them for the
     * reading thread.
     */
    private static final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        final BlockingQueue<byte[]> inbound = new LinkedBlockingQueue<>();
        volatile Throwable failure;

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
        {
            if (!msg.isReadable()) {
                return;
            }
            byte[] bytes = new byte[msg.readableBytes()];
            msg.getBytes(msg.readerIndex(), bytes);
            inbound.offer(bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            inbound.offer(END_OF_STREAM);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            failure = cause;
            ctx.close();
        }
    }
}
